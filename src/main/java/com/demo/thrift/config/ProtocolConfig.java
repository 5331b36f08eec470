package com.demo.thrift.config;

import com.demo.thrift.service.ProtocolPolicy;
import com.demo.thrift.service.support.Addresses;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Set;

@Slf4j
@Configuration
public class ProtocolConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ProtocolPolicy protocolPolicy(
            @Value("${thrift.escrow.liquidity-buffer-bps:1000}") int liquidityBufferBps,
            @Value("${thrift.escrow.group-yield-share-bps:8000}") int groupYieldShareBps,
            @Value("${thrift.stake.penalty-bps:2000}") int stakePenaltyBps,
            @Value("${thrift.stake.blacklist-threshold:3}") int blacklistThreshold,
            @Value("${thrift.trust.initial:100}") int initialTrust,
            @Value("${thrift.trust.reward:10}") int trustReward,
            @Value("${thrift.trust.penalty:50}") int trustPenalty,
            @Value("${thrift.trust.max:1000}") int maxTrust,
            @Value("${thrift.insurance.min-reserve-bps:1000}") int minReserveBps,
            @Value("${thrift.insurance.claim-cap:1000000000}") long claimCap,
            @Value("${thrift.insurance.emergency-cap:500000000}") long emergencyCap,
            @Value("${thrift.insurance.claim-cooldown:30d}") Duration claimCooldown,
            @Value("${thrift.insurance.approval-threshold:2}") int approvalThreshold,
            @Value("${thrift.admins:}") String admins,
            @Value("${thrift.insurance.processors:}") String processors,
            @Value("${thrift.platform.treasury:" + ProtocolPolicy.DEFAULT_TREASURY + "}") String treasury,
            @Value("${thrift.platform.group-creation-fee:0}") long groupCreationFee,
            @Value("${thrift.platform.creator-fee-share-bps:500}") int creatorFeeShareBps) {
        ProtocolPolicy policy = ProtocolPolicy.builder()
                .liquidityBufferBps(liquidityBufferBps)
                .groupYieldShareBps(groupYieldShareBps)
                .stakePenaltyBps(stakePenaltyBps)
                .blacklistThreshold(blacklistThreshold)
                .initialTrust(initialTrust)
                .trustReward(trustReward)
                .trustPenalty(trustPenalty)
                .maxTrust(maxTrust)
                .minReserveBps(minReserveBps)
                .claimCap(claimCap)
                .emergencyCap(emergencyCap)
                .claimCooldown(claimCooldown)
                .approvalThreshold(approvalThreshold)
                .admins(addresses(admins))
                .claimProcessors(addresses(processors))
                .treasury(Addresses.normalize(treasury))
                .groupCreationFee(groupCreationFee)
                .creatorFeeShareBps(creatorFeeShareBps)
                .build();
        log.info("Protocol policy: buffer={}bps yieldShare={}bps stakePenalty={}bps creationFee={} admins={} processors={}",
                liquidityBufferBps, groupYieldShareBps, stakePenaltyBps, groupCreationFee,
                policy.admins().size(), policy.claimProcessors().size());
        return policy;
    }

    private static Set<String> addresses(String csv) {
        if (!StringUtils.hasText(csv)) {
            return Set.of();
        }
        List<String> raw = Arrays.stream(csv.split(",")).map(String::trim).filter(s -> !s.isEmpty()).toList();
        return Addresses.normalizeAll(raw);
    }
}
