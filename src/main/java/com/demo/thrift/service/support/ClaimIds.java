package com.demo.thrift.service.support;

import org.web3j.crypto.Hash;

public final class ClaimIds {

    private ClaimIds() {}

    /** keccak-256 over the claim fields plus a sequence number, 0x-prefixed hex. */
    public static String claimId(String claimant, long groupId, long amount, String evidence, long sequence) {
        return Hash.sha3String(claimant + "|" + groupId + "|" + amount + "|" + evidence + "|" + sequence);
    }
}
