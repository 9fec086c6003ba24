// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
/// Metrics events and read only snapshots of the roles.
package com.github.essential_paxos.metrics;
