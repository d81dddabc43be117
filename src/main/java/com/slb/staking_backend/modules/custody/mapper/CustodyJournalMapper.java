package com.slb.staking_backend.modules.custody.mapper;

import com.slb.staking_backend.modules.custody.entity.CustodyJournal;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.List;

/**
 * MyBatis mapper：custody_journal 流水表（只追加）。
 */
@Mapper
public interface CustodyJournalMapper {

    int insert(CustodyJournal journal);

    List<CustodyJournal> findPaginated(@Param("offset") int offset, @Param("size") int size);

    long count();
}
