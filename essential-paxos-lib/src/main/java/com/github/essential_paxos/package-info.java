// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
/// Single decree Paxos as described in the paper Paxos Made Simple by Leslie Lamport.
///
/// The [com.github.essential_paxos.Acceptor], [com.github.essential_paxos.Proposer] and
/// [com.github.essential_paxos.Learner] are plain single threaded state machines for one slot. A
/// [com.github.essential_paxos.PaxosNode] hosts them behind a mutex and wires them to a
/// [com.github.essential_paxos.network.Messenger]. A [com.github.essential_paxos.InstanceCoordinator] runs many slots.
///
/// Safety only depends on the acceptor journal being crash durable. Liveness depends on the network eventually
/// delivering messages between a proposer and a quorum of acceptors.
package com.github.essential_paxos;
