// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
/// The protocol messages. Prepare, Accept and Decided are broadcast by a proposer. Promise, Nack and Accepted are
/// replies from acceptors and implement [com.github.essential_paxos.msg.ReplyMessage].
package com.github.essential_paxos.msg;
