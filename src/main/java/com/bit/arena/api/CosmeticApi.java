package com.bit.arena.api;

import com.bit.arena.common.AccountId;
import com.bit.arena.common.Hash32;
import com.bit.arena.cosmetic.CosmeticCatalog;
import com.bit.arena.result.Result;
import com.bit.arena.structure.cosmetic.CosmeticCategory;
import com.bit.arena.structure.cosmetic.CosmeticItem;
import com.bit.arena.structure.dto.CreateItemRequest;
import com.bit.arena.structure.dto.EquipRequest;
import com.bit.arena.structure.dto.MintRequest;
import com.bit.arena.structure.dto.TransferItemRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/cosmetic")
public class CosmeticApi {

    @Autowired
    private CosmeticCatalog cosmeticCatalog;

    // 创建物品（ADMIN）
    @PostMapping("/create")
    public Result<CosmeticItem> createItem(@RequestHeader("X-Caller") String caller,
                                           @RequestBody CreateItemRequest request) {
        Hash32 imageHash = request.getImageHash() == null ? Hash32.ZERO : Hash32.fromHex(request.getImageHash());
        return Result.OK(cosmeticCatalog.createItem(AccountId.fromHex(caller), request.getId(), request.getName(),
                request.getCategory(), request.getRarity(), imageHash, request.getMaxSupply(), request.getMinTier()));
    }

    // 铸造（ADMIN）
    @PostMapping("/mint")
    public Result<Long> mintItem(@RequestHeader("X-Caller") String caller, @RequestBody MintRequest request) {
        return Result.OK(cosmeticCatalog.mintItem(AccountId.fromHex(caller), AccountId.fromHex(request.getTo()),
                request.getItemId(), request.getAmount()));
    }

    @PostMapping("/equip")
    public Result<Void> equipItem(@RequestHeader("X-Caller") String caller, @RequestBody EquipRequest request) {
        cosmeticCatalog.equipItem(AccountId.fromHex(caller), CosmeticCategory.valueOf(request.getCategory()),
                request.getItemId());
        return Result.OK();
    }

    @PostMapping("/unequip")
    public Result<Void> unequipItem(@RequestHeader("X-Caller") String caller, @RequestParam String category) {
        cosmeticCatalog.unequipItem(AccountId.fromHex(caller), CosmeticCategory.valueOf(category));
        return Result.OK();
    }

    @PostMapping("/transfer")
    public Result<Void> transfer(@RequestHeader("X-Caller") String caller, @RequestBody TransferItemRequest request) {
        cosmeticCatalog.transfer(AccountId.fromHex(caller), AccountId.fromHex(request.getTo()),
                request.getItemId(), request.getAmount());
        return Result.OK();
    }

    @GetMapping("/item")
    public Result<CosmeticItem> getItem(@RequestParam long itemId) {
        return Result.OK(cosmeticCatalog.getItem(itemId));
    }

    @GetMapping("/balance")
    public Result<Long> balanceOf(@RequestParam String account, @RequestParam long itemId) {
        return Result.OK(cosmeticCatalog.balanceOf(AccountId.fromHex(account), itemId));
    }

    @GetMapping("/equipped")
    public Result<Long> getEquipped(@RequestParam String account, @RequestParam String category) {
        return Result.OK(cosmeticCatalog.getEquipped(AccountId.fromHex(account), CosmeticCategory.valueOf(category)));
    }

    @GetMapping("/equipValid")
    public Result<Boolean> isEquipValid(@RequestParam String account, @RequestParam String category) {
        return Result.OK(cosmeticCatalog.isEquipValid(AccountId.fromHex(account), CosmeticCategory.valueOf(category)));
    }

    @GetMapping("/loadout")
    public Result<Map<CosmeticCategory, Long>> getLoadout(@RequestParam String account) {
        return Result.OK(cosmeticCatalog.getLoadout(AccountId.fromHex(account)));
    }

    @GetMapping("/count")
    public Result<Long> itemCount() {
        return Result.OK(cosmeticCatalog.itemCount());
    }
}
