// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.essential_paxos.sim;

import com.github.essential_paxos.NodeId;
import com.github.essential_paxos.msg.PaxosMessage;

/// A hook that lets a test interfere with individual messages on top of the random faults of the link profile.
@FunctionalInterface
public interface Nemesis {

  Nemesis NONE = (to, message, now) -> Verdict.DELIVER;

  Verdict interfere(NodeId to, PaxosMessage message, long now);

  /// @param drop             lose the message.
  /// @param extraDelayMillis added to the delay sampled from the link profile.
  record Verdict(boolean drop, long extraDelayMillis) {
    public static final Verdict DELIVER = new Verdict(false, 0);
    public static final Verdict DROP = new Verdict(true, 0);

    public Verdict {
      if (extraDelayMillis < 0) {
        throw new IllegalArgumentException("extraDelayMillis must be >= 0 but was " + extraDelayMillis);
      }
    }

    public static Verdict delay(long extraDelayMillis) {
      return new Verdict(false, extraDelayMillis);
    }
  }
}
