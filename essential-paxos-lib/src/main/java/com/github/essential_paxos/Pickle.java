// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.essential_paxos;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.util.Optional;

/// Pickle is a utility class for serializing and deserializing the record types that the [Journal] uses.
/// Java serialization is famously broken but the Java Platform team are working on it.
/// This class does things the boilerplate way.
public class Pickle {

  public static byte[] writeAcceptorState(AcceptorState state) throws IOException {
    try (ByteArrayOutputStream byteArrayOutputStream = new ByteArrayOutputStream();
         DataOutputStream dos = new DataOutputStream(byteArrayOutputStream)) {
      write(state, dos);
      dos.flush();
      return byteArrayOutputStream.toByteArray();
    }
  }

  public static void write(AcceptorState state, DataOutputStream dos) throws IOException {
    dos.writeShort(state.acceptor().id());
    dos.writeLong(state.slot());
    dos.writeBoolean(state.promised().isPresent());
    if (state.promised().isPresent()) {
      write(state.promised().get(), dos);
    }
    dos.writeBoolean(state.accepted().isPresent());
    if (state.accepted().isPresent()) {
      final var proposal = state.accepted().get();
      write(proposal.id(), dos);
      final var bytes = proposal.value().bytes();
      dos.writeInt(bytes.length);
      dos.write(bytes);
    }
  }

  public static AcceptorState readAcceptorState(byte[] pickled) throws IOException {
    try (ByteArrayInputStream bis = new ByteArrayInputStream(pickled);
         DataInputStream dis = new DataInputStream(bis)) {
      return readAcceptorState(dis);
    }
  }

  private static AcceptorState readAcceptorState(DataInputStream dis) throws IOException {
    final var acceptor = new NodeId(dis.readShort());
    final long slot = dis.readLong();
    final Optional<ProposalId> promised = dis.readBoolean() ? Optional.of(readProposalId(dis)) : Optional.empty();
    Optional<Proposal> accepted = Optional.empty();
    if (dis.readBoolean()) {
      final var id = readProposalId(dis);
      final byte[] bytes = new byte[dis.readInt()];
      dis.readFully(bytes);
      accepted = Optional.of(new Proposal(id, new Value(bytes)));
    }
    return new AcceptorState(acceptor, slot, promised, accepted);
  }

  public static void write(ProposalId id, DataOutputStream dos) throws IOException {
    dos.writeLong(id.round());
    dos.writeShort(id.proposer().id());
  }

  public static ProposalId readProposalId(DataInputStream dis) throws IOException {
    return new ProposalId(dis.readLong(), new NodeId(dis.readShort()));
  }
}
