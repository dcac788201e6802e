package com.example.faceclusters.model;

import org.junit.jupiter.api.Test;

import java.awt.Rectangle;

import static org.junit.jupiter.api.Assertions.*;

public class BoundingBoxTest {

    @Test
    public void testToPixels_NormalizedBoxScaledToImage() {
        BoundingBox box = new BoundingBox(0.25, 0.5, 0.5, 0.25);

        assertTrue(box.isNormalized());
        assertEquals(new Rectangle(50, 100, 100, 50), box.toPixels(200, 200));
    }

    @Test
    public void testToPixels_PixelBoxClampedToImage() {
        BoundingBox box = new BoundingBox(150, 10, 100, 30);

        assertFalse(box.isNormalized());
        assertEquals(new Rectangle(150, 10, 50, 30), box.toPixels(200, 200), "Right edge is clipped");
    }

    @Test
    public void testIsEmpty() {
        assertTrue(new BoundingBox(1, 1, 0, 5).isEmpty());
        assertTrue(new BoundingBox(1, 1, 5, Double.NaN).isEmpty());
        assertFalse(new BoundingBox(1, 1, 5, 5).isEmpty());
    }

    @Test
    public void testToPixels_BoxOutsideImage_IsEmpty() {
        assertTrue(new BoundingBox(5000, 5000, 100, 100).toPixels(200, 200).isEmpty(), "Past the bottom right");
        assertTrue(new BoundingBox(-150, 10, 100, 30).toPixels(200, 200).isEmpty(), "Left of the image");
        assertTrue(new BoundingBox(10, 200, 30, 30).toPixels(200, 200).isEmpty(), "Starts on the bottom edge");
    }

    @Test
    public void testToPixels_BoxOverlappingLeftEdge_KeepsVisiblePart() {
        BoundingBox box = new BoundingBox(-50, 10, 100, 30);

        assertEquals(new Rectangle(0, 10, 50, 30), box.toPixels(200, 200));
    }

    @Test
    public void testIsNormalized_UnitSquarePixelBoxReadAsNormalized() {
        // A 1x1 pixel box at the origin cannot be told apart from the whole image
        BoundingBox box = new BoundingBox(0, 0, 1, 1);

        assertTrue(box.isNormalized());
        assertEquals(new Rectangle(0, 0, 200, 100), box.toPixels(200, 100));
    }
}
