package com.bit.arena.api;

import com.bit.arena.achievement.AchievementService;
import com.bit.arena.common.AccountId;
import com.bit.arena.common.Hash32;
import com.bit.arena.result.Result;
import com.bit.arena.structure.achievement.Achievement;
import com.bit.arena.structure.dto.ClaimRequest;
import com.bit.arena.util.ByteUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@Slf4j
@RestController
@RequestMapping("/achievement")
public class AchievementApi {

    @Autowired
    private AchievementService achievementService;

    // 后端签名的成就领取
    @PostMapping("/claim")
    public Result<Achievement> claim(@RequestBody ClaimRequest request) {
        return Result.OK(achievementService.claim(AccountId.fromHex(request.getTo()), request.getEventId(),
                request.getTier(), Hash32.fromHex(request.getMetadataHash()), request.getDeadline(),
                ByteUtils.hexToBytes(request.getSignature())));
    }

    @GetMapping("/has")
    public Result<Boolean> hasAchievement(@RequestParam String account, @RequestParam long eventId) {
        return Result.OK(achievementService.hasAchievement(AccountId.fromHex(account), eventId));
    }

    @GetMapping("/detail")
    public Result<Achievement> getAchievement(@RequestParam String account, @RequestParam long eventId) {
        return Result.OK(achievementService.getAchievement(AccountId.fromHex(account), eventId));
    }

    @GetMapping("/list")
    public Result<List<Achievement>> listForAccount(@RequestParam String account) {
        return Result.OK(achievementService.listForAccount(AccountId.fromHex(account)));
    }

    @GetMapping("/count")
    public Result<Long> countForAccount(@RequestParam String account) {
        return Result.OK(achievementService.countForAccount(AccountId.fromHex(account)));
    }
}
