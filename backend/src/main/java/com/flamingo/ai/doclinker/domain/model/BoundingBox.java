package com.flamingo.ai.doclinker.domain.model;

/**
 * Axis-aligned rectangle in page coordinate units, origin at the top-left corner of the page.
 *
 * @param x left edge
 * @param y top edge
 * @param width horizontal extent, never negative for well-formed input
 * @param height vertical extent, never negative for well-formed input
 */
public record BoundingBox(double x, double y, double width, double height) {

  public double right() {
    return x + width;
  }

  public double bottom() {
    return y + height;
  }

  public double centerX() {
    return x + width / 2.0;
  }

  public double centerY() {
    return y + height / 2.0;
  }

  public double area() {
    return width * height;
  }

  /** True when width and height are finite and non-negative. */
  public boolean wellFormed() {
    return Double.isFinite(x)
        && Double.isFinite(y)
        && Double.isFinite(width)
        && Double.isFinite(height)
        && width >= 0
        && height >= 0;
  }

  /** Whether the horizontal extents of the two boxes share at least one point. */
  public boolean overlapsHorizontally(BoundingBox other) {
    return x <= other.right() && other.x <= right();
  }

  /** Whether the vertical extents of the two boxes share at least one point. */
  public boolean overlapsVertically(BoundingBox other) {
    return y <= other.bottom() && other.y <= bottom();
  }

  public boolean intersects(BoundingBox other) {
    return overlapsHorizontally(other) && overlapsVertically(other);
  }

  public double intersectionArea(BoundingBox other) {
    double w = Math.min(right(), other.right()) - Math.max(x, other.x);
    double h = Math.min(bottom(), other.bottom()) - Math.max(y, other.y);
    return w <= 0 || h <= 0 ? 0.0 : w * h;
  }

  public boolean containsPoint(double px, double py) {
    return px >= x && px <= right() && py >= y && py <= bottom();
  }

  /** Euclidean distance between the two box centers. */
  public double centerDistance(BoundingBox other) {
    double dx = centerX() - other.centerX();
    double dy = centerY() - other.centerY();
    return Math.sqrt(dx * dx + dy * dy);
  }

  /** Shortest distance between the two rectangles; 0 when they touch or overlap. */
  public double gapDistance(BoundingBox other) {
    double dx = Math.max(0.0, Math.max(other.x - right(), x - other.right()));
    double dy = Math.max(0.0, Math.max(other.y - bottom(), y - other.bottom()));
    return Math.sqrt(dx * dx + dy * dy);
  }

  /** Minimal rectangle enclosing both boxes. */
  public BoundingBox union(BoundingBox other) {
    double minX = Math.min(x, other.x);
    double minY = Math.min(y, other.y);
    double maxX = Math.max(right(), other.right());
    double maxY = Math.max(bottom(), other.bottom());
    return new BoundingBox(minX, minY, maxX - minX, maxY - minY);
  }
}
