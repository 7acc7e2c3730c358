package com.codeheadsystems.onyx.client.model;

/**
 * What processing one inbound chat frame did.
 */
public enum ReceiveOutcome {
  SELF_ECHO,
  DELIVERED,
  NOT_ADDRESSED,
  UNREADABLE
}
