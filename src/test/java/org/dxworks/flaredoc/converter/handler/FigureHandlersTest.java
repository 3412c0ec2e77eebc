package org.dxworks.flaredoc.converter.handler;

import org.dxworks.flaredoc.TestUtils.Fixture;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

class FigureHandlersTest {

    private final Fixture fixture = new Fixture();

    @Test
    void captionBecomesBlockTitle() {
        String result = fixture.convert(
                "<figure><img src=\"i/f.png\" alt=\"F\"/><figcaption>The\n figure</figcaption></figure>");

        assertEquals(".The figure\nimage::f.png[F]\n", result);
    }

    @Test
    void figureWithoutCaptionPassesBody() {
        assertEquals("image::f.png[F]\n", fixture.convert("<figure><img src=\"i/f.png\" alt=\"F\"/></figure>"));
    }

    @Test
    void captionOutsideFigureIsDropped() {
        assertEquals("", fixture.convert("<figcaption>Lost</figcaption>"));
        assertEquals(List.of("Caption outside of a figure dropped"), fixture.warnings.messages);
    }

    @Test
    void secondCaptionIsDropped() {
        String result = fixture.convert(
                "<figure><figcaption>One</figcaption><figcaption>Two</figcaption></figure>");

        assertEquals(".One\n", result);
        assertEquals(List.of("Second caption in the same figure dropped"), fixture.warnings.messages);
    }
}
