package io.intellixity.vellum.hierarchy;

/** Left/right nested-set bounds of one tree node. */
public record NestedSetBounds(long lft, long rgt) {
  public NestedSetBounds {
    if (rgt < lft) throw new IllegalArgumentException("rgt < lft: " + lft + "/" + rgt);
  }

  /** {@code other} lies strictly inside this node. */
  public boolean contains(NestedSetBounds other) {
    return other.lft > lft && other.rgt < rgt;
  }
}
