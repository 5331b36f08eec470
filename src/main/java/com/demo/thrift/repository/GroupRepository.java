package com.demo.thrift.repository;

import com.demo.thrift.model.Group;
import com.demo.thrift.tx.JournaledCell;
import com.demo.thrift.tx.JournaledMap;
import com.demo.thrift.tx.LedgerTransactions;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

@Repository
public class GroupRepository {

    private final JournaledMap<Long, Group> groups;
    private final JournaledCell<Long> lastId;

    public GroupRepository(LedgerTransactions transactions) {
        this.groups = new JournaledMap<>(transactions);
        this.lastId = new JournaledCell<>(transactions, 0L);
    }

    /** Monotonic, starting at 1; a rolled back creation gives its id back. */
    public long nextId() {
        long id = lastId.get() + 1;
        lastId.set(id);
        return id;
    }

    public Optional<Group> findById(long id) {
        return groups.get(id);
    }

    public List<Group> findAll() {
        return groups.values();
    }

    public List<Group> findAll(Predicate<Group> filter) {
        return groups.values(filter);
    }

    public Group save(Group group) {
        groups.put(group.getId(), group);
        return group;
    }
}
