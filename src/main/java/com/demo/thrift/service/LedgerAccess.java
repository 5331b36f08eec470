package com.demo.thrift.service;

import com.demo.thrift.exception.PreconditionFailedException;
import com.demo.thrift.exception.UnauthorizedException;
import com.demo.thrift.tx.JournaledMap;
import com.demo.thrift.tx.LedgerTransactions;
import org.springframework.stereotype.Component;

/** Issues and checks {@link GroupGrant}s. A grant is honoured only if it is the instance issued here. */
@Component
public class LedgerAccess {

    private final JournaledMap<Long, GroupGrant> issued;

    public LedgerAccess(LedgerTransactions transactions) {
        this.issued = new JournaledMap<>(transactions);
    }

    GroupGrant issue(long groupId) {
        if (issued.containsKey(groupId)) {
            throw new PreconditionFailedException("Group " + groupId + " already has a grant");
        }
        GroupGrant grant = new GroupGrant(groupId);
        issued.put(groupId, grant);
        return grant;
    }

    public void verify(GroupGrant grant) {
        if (grant == null || issued.get(grant.groupId()).orElse(null) != grant) {
            throw new UnauthorizedException("Caller holds no ledger grant for this group");
        }
    }
}
