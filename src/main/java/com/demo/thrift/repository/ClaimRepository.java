package com.demo.thrift.repository;

import com.demo.thrift.model.InsuranceClaim;
import com.demo.thrift.tx.JournaledMap;
import com.demo.thrift.tx.LedgerTransactions;
import org.springframework.stereotype.Repository;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

@Repository
public class ClaimRepository {

    private final JournaledMap<String, InsuranceClaim> claims;

    public ClaimRepository(LedgerTransactions transactions) {
        this.claims = new JournaledMap<>(transactions);
    }

    public Optional<InsuranceClaim> findById(String id) {
        return claims.get(id);
    }

    public List<InsuranceClaim> findByClaimant(String claimant) {
        return claims.values(c -> c.getClaimant().equals(claimant));
    }

    public List<InsuranceClaim> findByGroup(long groupId) {
        return claims.values(c -> c.getGroupId() == groupId);
    }

    public Optional<InsuranceClaim> findLatest(long groupId, String claimant) {
        return claims.values(c -> c.getGroupId() == groupId && c.getClaimant().equals(claimant)).stream()
                .max(Comparator.comparing(InsuranceClaim::getSubmittedAt));
    }

    public int count() {
        return claims.size();
    }

    public InsuranceClaim save(InsuranceClaim claim) {
        claims.put(claim.getId(), claim);
        return claim;
    }
}
