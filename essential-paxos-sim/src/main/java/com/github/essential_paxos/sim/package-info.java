// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
/// Hosts for the protocol: a repeatable discrete event [com.github.essential_paxos.sim.SimulatedNetwork], a real time
/// [com.github.essential_paxos.sim.ThreadedNetwork] and a [com.github.essential_paxos.sim.TrialRunner] that measures
/// how a cluster behaves under faults.
package com.github.essential_paxos.sim;
