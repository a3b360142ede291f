package io.github.themoah.breakout.model;

/**
 * Growth rate derived from two snapshots of the same item. Never negative.
 */
public record Velocity(
  double scoreVelocity,    // points per minute
  double commentVelocity,  // comments per minute
  double elapsedMinutes    // minutes between the two snapshots
) {}
