// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.essential_paxos;

import java.util.logging.Logger;

/// We are using JUL logging to reduce dependencies. You can configure JUL logging to bridge to your chosen logging
/// framework. All classes in the library log to this one named logger so that a host can tune it in one place.
public final class PaxosLogger {
  public static final Logger LOGGER = Logger.getLogger("com.github.essential_paxos");

  private PaxosLogger() {
  }
}
