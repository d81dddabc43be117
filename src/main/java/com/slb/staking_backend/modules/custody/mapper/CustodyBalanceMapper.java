package com.slb.staking_backend.modules.custody.mapper;

import com.slb.staking_backend.modules.custody.entity.CustodyBalance;
import org.apache.ibatis.annotations.Mapper;

import java.util.Optional;

/**
 * MyBatis mapper：custody_balance 单行汇总表。
 */
@Mapper
public interface CustodyBalanceMapper {

    Optional<CustodyBalance> find();

    /**
     * SELECT ... FOR UPDATE 锁定汇总行，串行化所有台账变动。
     */
    Optional<CustodyBalance> lockForUpdate();

    int update(CustodyBalance balance);
}
