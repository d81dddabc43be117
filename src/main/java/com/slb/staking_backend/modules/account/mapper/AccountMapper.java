package com.slb.staking_backend.modules.account.mapper;

import com.slb.staking_backend.modules.account.entity.Account;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.Optional;

@Mapper
public interface AccountMapper {

    int insert(Account account);

    Optional<Account> selectById(@Param("id") Long id);

    Optional<Account> selectByAddress(@Param("address") String address);
}
