package com.demo.thrift.repository;

import com.demo.thrift.model.Member;
import com.demo.thrift.tx.JournaledMap;
import com.demo.thrift.tx.LedgerTransactions;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public class MemberRepository {

    private final JournaledMap<Key, Member> members;

    public MemberRepository(LedgerTransactions transactions) {
        this.members = new JournaledMap<>(transactions);
    }

    public Optional<Member> find(long groupId, String address) {
        return members.get(new Key(groupId, address));
    }

    /** Members of a group in join order. */
    public List<Member> findByGroup(long groupId) {
        return members.values(m -> m.getGroupId() == groupId);
    }

    public List<Member> findByAddress(String address) {
        return members.values(m -> m.getAddress().equals(address));
    }

    public Member save(Member member) {
        members.put(new Key(member.getGroupId(), member.getAddress()), member);
        return member;
    }

    private record Key(long groupId, String address) {}
}
