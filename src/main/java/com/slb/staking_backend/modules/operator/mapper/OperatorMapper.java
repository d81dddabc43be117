package com.slb.staking_backend.modules.operator.mapper;

import com.slb.staking_backend.modules.operator.entity.OperatorEntry;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.List;
import java.util.Optional;

@Mapper
public interface OperatorMapper {

    Optional<OperatorEntry> findByAddress(@Param("address") String address);

    /**
     * INSERT ... ON DUPLICATE KEY UPDATE enabled / updated_by / updated_at
     */
    int upsert(OperatorEntry entry);

    List<OperatorEntry> findAll();
}
