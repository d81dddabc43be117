package com.slb.staking_backend.support;

import com.slb.staking_backend.modules.custody.entity.CustodyJournal;
import com.slb.staking_backend.modules.custody.mapper.CustodyJournalMapper;

import java.util.Comparator;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

public class FakeCustodyJournalMapper extends InMemoryTable<Long, CustodyJournal> implements CustodyJournalMapper {

    private final AtomicLong ids = new AtomicLong();

    public FakeCustodyJournalMapper() {
        super(CustodyJournal::new);
    }

    @Override
    public int insert(CustodyJournal journal) {
        journal.setId(ids.incrementAndGet());
        write(journal.getId(), journal);
        return 1;
    }

    @Override
    public List<CustodyJournal> findPaginated(int offset, int size) {
        return select(j -> true).stream()
                .sorted(Comparator.comparing(CustodyJournal::getId).reversed())
                .skip(offset)
                .limit(size)
                .collect(Collectors.toList());
    }

    @Override
    public long count() {
        return size();
    }

    public List<CustodyJournal> all() {
        return select(j -> true);
    }
}
