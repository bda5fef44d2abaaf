/*
 * Copyright 2026 The Yulcomp Authors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.yulcomp.optimizer;

import com.google.common.collect.ImmutableSet;

/** The EVM flavour of Yul: untyped, with the EVM opcodes and object access as builtins. */
public final class EvmDialect implements Dialect {

  static final ImmutableSet<String> BUILTINS =
      ImmutableSet.of(
          // Arithmetic and comparison.
          "add", "sub", "mul", "div", "sdiv", "mod", "smod", "exp", "addmod", "mulmod",
          "signextend", "lt", "gt", "slt", "sgt", "eq", "iszero",
          // Bitwise.
          "not", "and", "or", "xor", "byte", "shl", "shr", "sar",
          // Memory, storage and hashing.
          "keccak256", "mload", "mstore", "mstore8", "msize", "mcopy", "sload", "sstore",
          "tload", "tstore",
          // Execution context.
          "stop", "pop", "pc", "gas", "address", "balance", "selfbalance", "caller", "callvalue",
          "calldataload", "calldatasize", "calldatacopy", "codesize", "codecopy", "extcodesize",
          "extcodecopy", "extcodehash", "returndatasize", "returndatacopy",
          // Calls and contract creation.
          "create", "create2", "call", "callcode", "delegatecall", "staticcall", "return",
          "revert", "selfdestruct", "invalid",
          // Logging.
          "log0", "log1", "log2", "log3", "log4",
          // Block and transaction information.
          "chainid", "basefee", "blobbasefee", "blobhash", "origin", "gasprice", "blockhash",
          "coinbase", "timestamp", "number", "difficulty", "prevrandao", "gaslimit",
          // Object access.
          "datasize", "dataoffset", "datacopy", "setimmutable", "loadimmutable",
          "linkersymbol", "memoryguard");

  @Override
  public String getName() {
    return "evm";
  }

  @Override
  public boolean isBuiltin(String name) {
    return BUILTINS.contains(name);
  }

  @Override
  public String toString() {
    return getName();
  }
}
