package com.slb.staking_backend.modules.vault.mapper;

import com.slb.staking_backend.modules.vault.entity.VaultShareBalance;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.Optional;

@Mapper
public interface VaultShareMapper {

    Optional<VaultShareBalance> findByOwner(@Param("ownerAddress") String ownerAddress);

    Optional<VaultShareBalance> lockByOwnerForUpdate(@Param("ownerAddress") String ownerAddress);

    int insert(VaultShareBalance balance);

    int update(VaultShareBalance balance);
}
