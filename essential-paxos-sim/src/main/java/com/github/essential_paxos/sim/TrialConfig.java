// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.essential_paxos.sim;

import com.github.essential_paxos.ProposerConfig;
import com.github.essential_paxos.network.LinkProfile;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Objects;
import java.util.Properties;

/// The settings of a batch of simulated trials.
///
/// @param acceptors          how many acceptor nodes.
/// @param proposers          how many proposer nodes. They all compete for the same slot.
/// @param learners           how many dedicated learner nodes. Proposers also learn.
/// @param link               the fault profile of every link.
/// @param proposer           the timing of every proposer.
/// @param trials             how many trials [TrialRunner#runAll(TrialConfig)] runs.
/// @param seed               the seed of the first trial. Trial `i` uses `seed + i`.
/// @param maxSimulatedMillis virtual time after which a trial that has not finished is cut short.
public record TrialConfig(int acceptors,
                          int proposers,
                          int learners,
                          LinkProfile link,
                          ProposerConfig proposer,
                          int trials,
                          long seed,
                          long maxSimulatedMillis) {

  static final String DEFAULTS = "/essential-paxos.properties";
  static final String PREFIX = "essential-paxos.";

  public TrialConfig {
    if (acceptors < 1) throw new IllegalArgumentException("acceptors must be at least 1 but was " + acceptors);
    if (proposers < 1) throw new IllegalArgumentException("proposers must be at least 1 but was " + proposers);
    if (learners < 0) throw new IllegalArgumentException("learners must be >= 0 but was " + learners);
    if (acceptors > 99 || proposers > 99 || learners > 99) {
      throw new IllegalArgumentException("at most 99 nodes of each role are supported");
    }
    Objects.requireNonNull(link, "link");
    Objects.requireNonNull(proposer, "proposer");
    if (trials < 0) throw new IllegalArgumentException("trials must be >= 0 but was " + trials);
    if (maxSimulatedMillis <= 0) {
      throw new IllegalArgumentException("maxSimulatedMillis must be positive but was " + maxSimulatedMillis);
    }
  }

  /// The defaults on the classpath overlaid with the given properties.
  public static TrialConfig fromProperties(Properties overrides) {
    final var merged = defaults();
    merged.putAll(overrides);
    return new TrialConfig(
        Integer.parseInt(get(merged, "acceptors")),
        Integer.parseInt(get(merged, "proposers")),
        Integer.parseInt(get(merged, "learners")),
        new LinkProfile(
            Long.parseLong(get(merged, "link.minDelayMillis")),
            Long.parseLong(get(merged, "link.maxDelayMillis")),
            Double.parseDouble(get(merged, "link.dropProbability")),
            Double.parseDouble(get(merged, "link.duplicateProbability")),
            Boolean.parseBoolean(get(merged, "link.fifo"))),
        new ProposerConfig(
            Long.parseLong(get(merged, "proposer.roundDeadlineMillis")),
            Integer.parseInt(get(merged, "proposer.maxRetries")),
            Long.parseLong(get(merged, "proposer.backoffBaseMillis")),
            Long.parseLong(get(merged, "proposer.backoffMaxMillis"))),
        Integer.parseInt(get(merged, "trials")),
        Long.parseLong(get(merged, "seed")),
        Long.parseLong(get(merged, "maxSimulatedMillis")));
  }

  /// The defaults on the classpath overlaid with `-Dessential-paxos.*` system properties.
  public static TrialConfig fromSystemProperties() {
    return fromProperties(System.getProperties());
  }

  static Properties defaults() {
    final var properties = new Properties();
    try (InputStream in = TrialConfig.class.getResourceAsStream(DEFAULTS)) {
      if (in == null) {
        throw new IllegalStateException("missing " + DEFAULTS + " on the classpath");
      }
      properties.load(in);
    } catch (IOException e) {
      throw new UncheckedIOException("unable to read " + DEFAULTS, e);
    }
    return properties;
  }

  private static String get(Properties properties, String key) {
    final var value = properties.getProperty(PREFIX + key);
    if (value == null) {
      throw new IllegalArgumentException("missing property " + PREFIX + key);
    }
    return value.trim();
  }

  public TrialConfig withLink(LinkProfile link) {
    return new TrialConfig(acceptors, proposers, learners, link, proposer, trials, seed, maxSimulatedMillis);
  }

  public TrialConfig withProposer(ProposerConfig proposer) {
    return new TrialConfig(acceptors, proposers, learners, link, proposer, trials, seed, maxSimulatedMillis);
  }

  public TrialConfig withNodes(int acceptors, int proposers, int learners) {
    return new TrialConfig(acceptors, proposers, learners, link, proposer, trials, seed, maxSimulatedMillis);
  }

  public TrialConfig withTrials(int trials, long seed) {
    return new TrialConfig(acceptors, proposers, learners, link, proposer, trials, seed, maxSimulatedMillis);
  }
}
