// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.essential_paxos;

import com.github.essential_paxos.msg.PaxosMessage;
import com.github.essential_paxos.network.MessageHandler;
import com.github.essential_paxos.network.Messenger;

import java.util.ArrayList;
import java.util.List;

/// A messenger that delivers nothing and remembers what was sent.
class RecordingMessenger implements Messenger {
  record Sent(NodeId to, PaxosMessage message) {
  }

  final List<Sent> sent = new ArrayList<>();

  @Override
  public void register(NodeId node, MessageHandler handler) {
  }

  @Override
  public void send(NodeId to, PaxosMessage message) {
    sent.add(new Sent(to, message));
  }

  <T extends PaxosMessage> List<T> sentOfType(Class<T> type) {
    return sent.stream().map(Sent::message).filter(type::isInstance).map(type::cast).toList();
  }

  void clear() {
    sent.clear();
  }
}
