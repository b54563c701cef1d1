package com.trustplatform.common.policy;

/**
 * How the engine treats a validation whose timestamp is earlier than the
 * agent's last recorded update.
 *
 * <ul>
 *   <li>{@link #REJECT}: fail with {@code InvalidInputException}; nothing is written.</li>
 *   <li>{@link #CLAMP}:  accept it as if no time had elapsed; the stored
 *       last-update timestamp does not move backwards.</li>
 * </ul>
 */
public enum OutOfOrderPolicy {
    REJECT,
    CLAMP
}
