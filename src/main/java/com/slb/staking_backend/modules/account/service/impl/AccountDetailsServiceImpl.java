package com.slb.staking_backend.modules.account.service.impl;

import com.slb.staking_backend.common.exception.BizException;
import com.slb.staking_backend.common.security.CustomUserDetails;
import com.slb.staking_backend.modules.account.entity.Account;
import com.slb.staking_backend.modules.account.mapper.AccountMapper;
import org.springframework.security.core.userdetails.UserDetails;
import org.springframework.security.core.userdetails.UserDetailsService;
import org.springframework.security.core.userdetails.UsernameNotFoundException;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.Locale;

@Service
public class AccountDetailsServiceImpl implements UserDetailsService {

    private final AccountMapper accountMapper;

    public AccountDetailsServiceImpl(AccountMapper accountMapper) {
        this.accountMapper = accountMapper;
    }

    @Override
    public UserDetails loadUserByUsername(String address) throws UsernameNotFoundException {
        if (!StringUtils.hasText(address)) {
            throw new UsernameNotFoundException("地址不能为空");
        }
        // 地址统一按小写存储
        Account account = accountMapper.selectByAddress(address.trim().toLowerCase(Locale.ROOT))
                .orElseThrow(() -> new UsernameNotFoundException("地址: " + address + " 未注册"));
        if (account.getStatus() == null || account.getStatus() == 0) {
            throw new BizException(403, "账户已被禁用");
        }
        return new CustomUserDetails(account);
    }
}
