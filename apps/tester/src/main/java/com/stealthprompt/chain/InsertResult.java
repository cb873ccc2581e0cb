package com.stealthprompt.chain;

import com.stealthprompt.chain.domain.AttackChainEntry;

/**
 * @param entry    the stored entry (the pre-existing one when the chain was already known)
 * @param inserted false when the insert was a no-op
 */
public record InsertResult(AttackChainEntry entry, boolean inserted) {
}
