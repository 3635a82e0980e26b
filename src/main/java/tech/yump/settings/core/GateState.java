package tech.yump.settings.core;

public enum GateState {
  /** The settings type has no encrypted field anywhere; no password is ever requested. */
  NO_ENCRYPTION_NEEDED,
  /** Encrypted fields exist but no password has been accepted yet. */
  NEED_PASSWORD,
  /** A verified password is held in memory. */
  UNLOCKED
}
