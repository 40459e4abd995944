package org.lupenghan.pagelayout.geometry.models;

import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertTrue;

public class GeometryModelsTest {

    @Test
    public void testMarginsSums() {
        Margins margins = new Margins(10.0, 5.0, 12.0, 7.0);
        assertEquals(22.0, margins.horizontal(), 0.0);
        assertEquals(12.0, margins.vertical(), 0.0);
        assertEquals(new Margins(10.0, 5.0, 12.0, 7.0), margins);
        assertNotEquals(new Margins(5.0, 10.0, 12.0, 7.0), margins);
    }

    @Test
    public void testRectEmpty() {
        assertTrue(RectF.EMPTY.isEmpty());
        assertTrue(new RectF(10, 10, 0, 50).isEmpty());
        assertFalse(new RectF(0, 0, 100, 50).isEmpty());
    }

    @Test
    public void testAlignmentCodes() {
        assertEquals(Alignment.Vertical.BOTTOM, Alignment.Vertical.fromValue(2));
        assertEquals(Alignment.Horizontal.HCENTER, Alignment.Horizontal.fromValue(1));
        assertEquals(new Alignment(Alignment.Vertical.TOP, Alignment.Horizontal.LEFT),
                new Alignment(Alignment.Vertical.fromValue(0), Alignment.Horizontal.fromValue(0)));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testAlignmentInvalidCode() {
        Alignment.Horizontal.fromValue(-1);
    }
}
