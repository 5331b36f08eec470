package com.demo.thrift.service;

import com.demo.thrift.exception.InsufficientBalanceException;
import com.demo.thrift.exception.InvalidInputException;
import com.demo.thrift.exception.NotFoundException;
import com.demo.thrift.model.Group;
import com.demo.thrift.model.GroupModel;
import com.demo.thrift.model.GroupStatus;
import com.demo.thrift.service.dto.PlatformStats;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static com.demo.thrift.service.LedgerFixture.*;
import static org.assertj.core.api.Assertions.*;

class GroupRegistryTest {

    private LedgerFixture fx;

    @BeforeEach
    void setUp() {
        fx = new LedgerFixture();
    }

    @Test
    @DisplayName("Ids are sequential and each group gets its own escrow account and insurance pool")
    void createsGroups() {
        Group first = fx.registry.createGroup(CREATOR, config(GroupModel.ROTATIONAL).build());
        Group second = fx.registry.createGroup(ALICE, config(GroupModel.EMERGENCY_LIQUIDITY).build());

        assertThat(first.getId()).isEqualTo(1);
        assertThat(second.getId()).isEqualTo(2);
        assertThat(first.getStatus()).isEqualTo(GroupStatus.CREATED);
        assertThat(first.getCreator()).isEqualTo(CREATOR);
        assertThat(first.getCreatedAt()).isEqualTo(fx.clock.instant());
        assertThat(fx.escrowLedger.groupValue(1).total()).isZero();
        assertThat(fx.insuranceLedger.pool(1).emergencyMode()).isFalse();
        assertThat(fx.insuranceLedger.pool(2).emergencyMode()).isTrue();
    }

    @Test
    @DisplayName("A refused creation does not consume an id")
    void refusedCreation() {
        assertThatThrownBy(() -> fx.registry.createGroup("not-an-address", config(GroupModel.ROTATIONAL).build()))
                .isInstanceOf(InvalidInputException.class);
        assertThatThrownBy(() -> fx.registry.createGroup(CREATOR, null))
                .isInstanceOf(InvalidInputException.class);

        assertThat(fx.registry.createGroup(CREATOR, config(GroupModel.ROTATIONAL).build()).getId()).isEqualTo(1);
        assertThatThrownBy(() -> fx.lifecycle.getGroup(2)).isInstanceOf(NotFoundException.class);
    }

    @Test
    @DisplayName("The creation fee goes to the treasury and an unpaid fee creates nothing")
    void creationFee() {
        LedgerFixture paid = new LedgerFixture(testPolicy().toBuilder().groupCreationFee(25).build());
        paid.fund(CREATOR, 40);

        Group group = paid.registry.createGroup(CREATOR, config(GroupModel.ROTATIONAL).build());

        assertThat(group.getId()).isEqualTo(1);
        assertThat(paid.balance(TREASURY)).isEqualTo(25);
        assertThat(paid.balance(CREATOR)).isEqualTo(15);
        assertThat(paid.escrowLedger.groupValue(1).total()).isZero();

        assertThatThrownBy(() -> paid.registry.createGroup(CREATOR, config(GroupModel.ROTATIONAL).build()))
                .isInstanceOf(InsufficientBalanceException.class)
                .hasMessageContaining("creation fee");
        assertThat(paid.balance(CREATOR)).isEqualTo(15);
        assertThat(paid.registry.allGroups()).hasSize(1);

        paid.fund(CREATOR, 10);
        assertThat(paid.registry.createGroup(CREATOR, config(GroupModel.ROTATIONAL).build()).getId()).isEqualTo(2);
    }

    @Test
    @DisplayName("Groups can be listed by creator, member and model")
    void filters() {
        long rotational = fx.activeGroup(config(GroupModel.ROTATIONAL).build(), 1_000, ALICE, BOB, CAROL).getId();
        long savings = fx.registry.createGroup(ALICE, config(GroupModel.FIXED_SAVINGS)
                .lockDuration(Duration.ofDays(60)).build()).getId();
        fx.lifecycle.join(savings, DAVE);

        assertThat(fx.registry.groupsByCreator(CREATOR)).extracting(Group::getId).containsExactly(rotational);
        assertThat(fx.registry.groupsByCreator(ALICE)).extracting(Group::getId).containsExactly(savings);
        assertThat(fx.registry.groupsByMember(ALICE)).extracting(Group::getId).containsExactly(rotational);
        assertThat(fx.registry.groupsByMember(DAVE)).extracting(Group::getId).containsExactly(savings);
        assertThat(fx.registry.groupsByModel(GroupModel.FIXED_SAVINGS)).extracting(Group::getId)
                .containsExactly(savings);
        assertThat(fx.registry.groupsByModel(GroupModel.EMERGENCY_LIQUIDITY)).isEmpty();
        assertThat(fx.registry.allGroups()).hasSize(2);
    }

    @Test
    @DisplayName("Platform stats count groups by status and model and sum escrowed value")
    void stats() {
        long id = fx.activeGroup(config(GroupModel.ROTATIONAL).build(), 1_000, ALICE, BOB, CAROL).getId();
        fx.lifecycle.contribute(id, ALICE);
        fx.lifecycle.contribute(id, BOB);
        long other = fx.registry.createGroup(CREATOR, config(GroupModel.ROTATIONAL).build()).getId();
        fx.lifecycle.cancel(other, CREATOR);

        PlatformStats stats = fx.registry.platformStats();

        assertThat(stats.getTotalGroups()).isEqualTo(2);
        assertThat(stats.getActiveGroups()).isEqualTo(1);
        assertThat(stats.getCancelledGroups()).isEqualTo(1);
        assertThat(stats.getCompletedGroups()).isZero();
        assertThat(stats.getTotalMembers()).isEqualTo(3);
        assertThat(stats.getTotalValueLocked()).isEqualTo(200);
        assertThat(stats.getGroupsByModel()).containsEntry(GroupModel.ROTATIONAL, 2L);
    }
}
