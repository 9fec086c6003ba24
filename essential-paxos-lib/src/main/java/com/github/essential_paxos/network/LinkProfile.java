// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.essential_paxos.network;

import java.util.random.RandomGenerator;

/// How a link between two nodes misbehaves.
///
/// @param minDelayMillis       the smallest delivery delay.
/// @param maxDelayMillis       the largest delivery delay. Delays are uniform between min and max inclusive.
/// @param dropProbability      the chance that a message is lost.
/// @param duplicateProbability the chance that a message is delivered twice.
/// @param fifo                 when true messages on the link are delivered in the order they were sent.
public record LinkProfile(long minDelayMillis,
                          long maxDelayMillis,
                          double dropProbability,
                          double duplicateProbability,
                          boolean fifo) {

  public static final LinkProfile RELIABLE = new LinkProfile(1, 1, 0.0, 0.0, true);

  public LinkProfile {
    if (minDelayMillis < 0 || maxDelayMillis < minDelayMillis) {
      throw new IllegalArgumentException("delays must satisfy 0 <= min <= max but were "
          + minDelayMillis + " and " + maxDelayMillis);
    }
    checkProbability("dropProbability", dropProbability);
    checkProbability("duplicateProbability", duplicateProbability);
  }

  private static void checkProbability(String name, double p) {
    if (!(p >= 0.0 && p <= 1.0)) {
      throw new IllegalArgumentException(name + " must be in [0, 1] but was " + p);
    }
  }

  public LinkProfile withDelay(long minDelayMillis, long maxDelayMillis) {
    return new LinkProfile(minDelayMillis, maxDelayMillis, dropProbability, duplicateProbability, fifo);
  }

  public LinkProfile withDropProbability(double dropProbability) {
    return new LinkProfile(minDelayMillis, maxDelayMillis, dropProbability, duplicateProbability, fifo);
  }

  public LinkProfile withDuplicateProbability(double duplicateProbability) {
    return new LinkProfile(minDelayMillis, maxDelayMillis, dropProbability, duplicateProbability, fifo);
  }

  public LinkProfile withFifo(boolean fifo) {
    return new LinkProfile(minDelayMillis, maxDelayMillis, dropProbability, duplicateProbability, fifo);
  }

  public long sampleDelay(RandomGenerator random) {
    if (minDelayMillis == maxDelayMillis) {
      return minDelayMillis;
    }
    return random.nextLong(minDelayMillis, maxDelayMillis + 1);
  }

  public boolean sampleDrop(RandomGenerator random) {
    return dropProbability > 0.0 && random.nextDouble() < dropProbability;
  }

  public boolean sampleDuplicate(RandomGenerator random) {
    return duplicateProbability > 0.0 && random.nextDouble() < duplicateProbability;
  }
}
