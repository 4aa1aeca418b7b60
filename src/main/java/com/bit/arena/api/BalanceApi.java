package com.bit.arena.api;

import com.bit.arena.balance.BalanceLedger;
import com.bit.arena.common.AccountId;
import com.bit.arena.result.Result;
import com.bit.arena.structure.dto.DepositRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.web.bind.annotation.*;

@Slf4j
@RestController
@RequestMapping("/balance")
public class BalanceApi {

    @Autowired
    private BalanceLedger balanceLedger;

    // 查询余额
    @GetMapping("/of")
    public Result<Long> balanceOf(@RequestParam String account) {
        return Result.OK(balanceLedger.balanceOf(AccountId.fromHex(account)));
    }

    @GetMapping("/supply")
    public Result<Long> totalSupply() {
        return Result.OK(balanceLedger.totalSupply());
    }

    // 入金（ADMIN）
    @PostMapping("/deposit")
    public Result<Long> deposit(@RequestHeader("X-Caller") String caller, @RequestBody DepositRequest request) {
        return Result.OK(balanceLedger.deposit(AccountId.fromHex(caller), AccountId.fromHex(request.getTo()),
                request.getAmount()));
    }
}
