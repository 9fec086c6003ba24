// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
/// The contracts a host provides to a [com.github.essential_paxos.PaxosNode]: a [com.github.essential_paxos.network.Messenger]
/// to move messages and a [com.github.essential_paxos.network.Scheduler] for the clock and timers.
package com.github.essential_paxos.network;
