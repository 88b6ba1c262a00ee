package com.hcltech.dawg.common.codec;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JacksonTypedJsonCodecTest {

    public record Point(int x, String name, List<Integer> tags) {}

    @Test
    void encodesRecordComponentsAsFields() {
        Codec<Point, String> c = Codec.clazzCodec(Point.class);
        String json = c.encode(new Point(3, "p", List.of(1, 2))).valueOrThrow();
        assertTrue(json.contains("\"x\":3"));
        assertTrue(json.contains("\"name\":\"p\""));
        assertTrue(json.contains("\"tags\":[1,2]"));
    }

    @Test
    void decodesRecords() {
        Codec<Point, String> c = Codec.clazzCodec(Point.class);
        assertEquals(new Point(1, "a", List.of()), c.decode("{\"x\":1,\"name\":\"a\",\"tags\":[]}").valueOrThrow());
    }

    @Test
    void badJsonIsAnErrorNotAnException() {
        Codec<Point, String> c = Codec.clazzCodec(Point.class);
        var result = c.decode("{not json");
        assertTrue(result.isError());
        assertTrue(result.getErrors().get(0).startsWith("Failed to decode Point from JSON"));
        assertTrue(c.decode(null).isError());
    }

    @Test
    void prettyCodecIndents() {
        String json = Codec.prettyClazzCodec(Point.class).encode(new Point(1, "a", List.of())).valueOrThrow();
        assertTrue(json.contains("\n"));
    }

    @Test
    void invertSwapsDirections() {
        Codec<String, Point> inverted = Codec.clazzCodec(Point.class).invert();
        Point p = inverted.encode("{\"x\":9,\"name\":\"z\",\"tags\":[4]}").valueOrThrow();
        assertEquals(9, p.x());
        assertEquals(p, inverted.encode(inverted.decode(p).valueOrThrow()).valueOrThrow());
    }
}
