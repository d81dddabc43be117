package com.slb.staking_backend.modules.custody.mapper;

import com.slb.staking_backend.modules.custody.entity.FundingReceipt;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.Optional;

/**
 * MyBatis mapper：funding_receipt（只插入，主键为交易哈希）。
 */
@Mapper
public interface FundingReceiptMapper {

    /**
     * 交易哈希已存在时抛出 {@link org.springframework.dao.DuplicateKeyException}。
     */
    int insert(FundingReceipt receipt);

    Optional<FundingReceipt> findByTxHash(@Param("txHash") String txHash);
}
