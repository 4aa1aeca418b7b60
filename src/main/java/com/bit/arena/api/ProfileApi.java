package com.bit.arena.api;

import com.bit.arena.auth.AuthorizationVerifier;
import com.bit.arena.common.AccountId;
import com.bit.arena.profile.ProfileService;
import com.bit.arena.result.Result;
import com.bit.arena.structure.auth.NonceScope;
import com.bit.arena.structure.dto.RegisterForRequest;
import com.bit.arena.structure.dto.StatsUpdateRequest;
import com.bit.arena.structure.profile.Profile;
import com.bit.arena.structure.profile.ProfileStats;
import com.bit.arena.structure.profile.Tier;
import com.bit.arena.util.ByteUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.web.bind.annotation.*;

@Slf4j
@RestController
@RequestMapping("/profile")
public class ProfileApi {

    @Autowired
    private ProfileService profileService;

    @Autowired
    private AuthorizationVerifier authorizationVerifier;

    // 自行注册
    @PostMapping("/register")
    public Result<Profile> register(@RequestHeader("X-Caller") String caller) {
        return Result.OK(profileService.register(AccountId.fromHex(caller)));
    }

    // 中继注册，签名来自账户本人
    @PostMapping("/registerFor")
    public Result<Profile> registerFor(@RequestBody RegisterForRequest request) {
        return Result.OK(profileService.registerFor(AccountId.fromHex(request.getAccount()),
                request.getDeadline(), ByteUtils.hexToBytes(request.getSignature())));
    }

    // 后端签名的统计更新
    @PostMapping("/updateStats")
    public Result<Profile> updateStats(@RequestBody StatsUpdateRequest request) {
        ProfileStats stats = new ProfileStats(request.getXp(), request.getLevel(),
                request.getProgressCount(), request.getAchievementCount());
        return Result.OK(profileService.updateStats(AccountId.fromHex(request.getAccount()), stats,
                request.getDeadline(), ByteUtils.hexToBytes(request.getSignature())));
    }

    @GetMapping("/detail")
    public Result<Profile> getProfile(@RequestParam String account) {
        return Result.OK(profileService.getProfile(AccountId.fromHex(account)));
    }

    @GetMapping("/registered")
    public Result<Boolean> isRegistered(@RequestParam String account) {
        return Result.OK(profileService.isRegistered(AccountId.fromHex(account)));
    }

    @GetMapping("/tier")
    public Result<Tier> getTier(@RequestParam String account) {
        return Result.OK(profileService.getTier(AccountId.fromHex(account)));
    }

    @GetMapping("/count")
    public Result<Long> registeredCount() {
        return Result.OK(profileService.registeredCount());
    }

    // 签名端需要知道当前 nonce
    @GetMapping("/nonce")
    public Result<Long> nonceOf(@RequestParam String account, @RequestParam String scope) {
        return Result.OK(authorizationVerifier.nonceOf(AccountId.fromHex(account), NonceScope.valueOf(scope)));
    }

    @GetMapping("/domainSeparator")
    public Result<String> domainSeparator() {
        return Result.OK(authorizationVerifier.domainSeparator().toHex());
    }
}
