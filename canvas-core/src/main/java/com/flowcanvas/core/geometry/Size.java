package com.flowcanvas.core.geometry;

/**
 * Width and height of an axis-aligned box.
 */
public record Size(double width, double height) {
}
