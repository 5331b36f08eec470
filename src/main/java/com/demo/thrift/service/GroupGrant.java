package com.demo.thrift.service;

/**
 * Write capability for one group on the stake, escrow and insurance ledgers. Only
 * {@link LedgerAccess} creates these, and only on behalf of {@link GroupRegistry}.
 */
public final class GroupGrant {

    private final long groupId;

    GroupGrant(long groupId) {
        this.groupId = groupId;
    }

    public long groupId() {
        return groupId;
    }

    @Override
    public String toString() {
        return "GroupGrant[" + groupId + "]";
    }
}
