package com.bit.arena.cosmetic.impl;

import com.bit.arena.access.AccessControlService;
import com.bit.arena.common.AccountId;
import com.bit.arena.common.Hash32;
import com.bit.arena.common.LedgerSequencer;
import com.bit.arena.common.SystemAccounts;
import com.bit.arena.cosmetic.CosmeticCatalog;
import com.bit.arena.exception.CapacityException;
import com.bit.arena.exception.ErrorType;
import com.bit.arena.exception.StateException;
import com.bit.arena.exception.ValidationException;
import com.bit.arena.structure.access.Role;
import com.bit.arena.structure.cosmetic.CosmeticCategory;
import com.bit.arena.structure.cosmetic.CosmeticItem;
import com.bit.arena.structure.cosmetic.Rarity;
import com.bit.arena.structure.notification.CosmeticNotifications;
import com.google.common.collect.ImmutableMap;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Map;

@Slf4j
@Component
public class CosmeticCatalogImpl implements CosmeticCatalog {

    public static final int MAX_MIN_TIER = 5;

    private final Map<Long, CosmeticItem> items = new HashMap<>();

    /**
     * 持有量：账户 -> (物品 -> 数量)，数量为 0 的条目不保留
     */
    private final Map<AccountId, Map<Long, Long>> holdings = new HashMap<>();

    /**
     * 装备槽：账户 -> (分类 -> 物品)
     */
    private final Map<AccountId, EnumMap<CosmeticCategory, Long>> loadouts = new HashMap<>();

    private final AccessControlService accessControl;
    private final LedgerSequencer sequencer;
    private final ApplicationEventPublisher publisher;
    private final Clock clock;

    public CosmeticCatalogImpl(AccessControlService accessControl, LedgerSequencer sequencer,
                               ApplicationEventPublisher publisher, Clock clock) {
        this.accessControl = accessControl;
        this.sequencer = sequencer;
        this.publisher = publisher;
        this.clock = clock;
    }

    @Override
    public CosmeticItem createItem(AccountId caller, long id, String name, int categoryCode, int rarityCode,
                                   Hash32 imageHash, long maxSupply, int minTier) {
        return sequencer.write(() -> {
            accessControl.checkRole(Role.ADMIN, caller);
            if (items.containsKey(id)) {
                throw new StateException(ErrorType.ALREADY_EXISTS, "物品 " + id);
            }
            CosmeticCategory category = CosmeticCategory.fromCode(categoryCode);
            if (category == null) {
                throw new ValidationException(ErrorType.INVALID_CATEGORY, "code=" + categoryCode);
            }
            Rarity rarity = Rarity.fromCode(rarityCode);
            if (rarity == null) {
                throw new ValidationException(ErrorType.INVALID_RARITY, "code=" + rarityCode);
            }
            if (minTier < 0 || minTier > MAX_MIN_TIER) {
                throw new ValidationException(ErrorType.INVALID_TIER, "minTier=" + minTier);
            }
            if (maxSupply < 0) {
                throw new ValidationException(ErrorType.INVALID_AMOUNT, "maxSupply=" + maxSupply);
            }
            CosmeticItem item = new CosmeticItem();
            item.setId(id);
            item.setName(name);
            item.setCategory(category);
            item.setRarity(rarity);
            item.setImageHash(imageHash == null ? Hash32.ZERO : imageHash);
            item.setMaxSupply(maxSupply);
            item.setMinTier(minTier);
            items.put(id, item);
            log.info("创建物品 {}「{}」{} {} 最大供应 {}", id, name, category, rarity, maxSupply);
            publisher.publishEvent(new CosmeticNotifications.ItemCreated(id, name, category, rarity, maxSupply,
                    minTier, now()));
            return item.copy();
        });
    }

    @Override
    public long mintItem(AccountId caller, AccountId to, long itemId, long amount) {
        return sequencer.write(() -> {
            accessControl.checkRole(Role.ADMIN, caller);
            CosmeticItem item = require(itemId);
            checkAmount(amount);
            long supply;
            try {
                supply = Math.addExact(item.getCurrentSupply(), amount);
            } catch (ArithmeticException e) {
                throw new ValidationException(ErrorType.AMOUNT_OVERFLOW, "供应量溢出");
            }
            if (!item.canMint(amount)) {
                throw new CapacityException(ErrorType.MAX_SUPPLY_REACHED,
                        "物品 " + itemId + " 当前 " + item.getCurrentSupply() + " 上限 " + item.getMaxSupply());
            }
            credit(to, itemId, amount);
            item.setCurrentSupply(supply);
            log.info("铸造物品 {} x{} -> {}，当前供应 {}", itemId, amount, to, supply);
            publisher.publishEvent(new CosmeticNotifications.ItemMinted(to, itemId, amount, supply, now()));
            return supply;
        });
    }

    @Override
    public void equipItem(AccountId caller, CosmeticCategory category, long itemId) {
        sequencer.execute(() -> {
            // 未知物品的持有量也是 0，先报 ITEM_NOT_OWNED
            if (balance(caller, itemId) < 1) {
                throw new StateException(ErrorType.ITEM_NOT_OWNED, caller + " 未持有物品 " + itemId);
            }
            CosmeticItem item = require(itemId);
            if (item.getCategory() != category) {
                throw new ValidationException(ErrorType.INVALID_CATEGORY,
                        "物品 " + itemId + " 属于 " + item.getCategory() + "，不能装备到 " + category);
            }
            loadouts.computeIfAbsent(caller, k -> new EnumMap<>(CosmeticCategory.class)).put(category, itemId);
            log.debug("装备 {} {} -> {}", caller, category, itemId);
            publisher.publishEvent(new CosmeticNotifications.ItemEquipped(caller, category, itemId, now()));
        });
    }

    @Override
    public void unequipItem(AccountId caller, CosmeticCategory category) {
        sequencer.execute(() -> {
            EnumMap<CosmeticCategory, Long> loadout = loadouts.get(caller);
            Long itemId = loadout == null ? null : loadout.remove(category);
            if (itemId == null) {
                throw new StateException(ErrorType.ITEM_NOT_EQUIPPED, caller + " " + category);
            }
            if (loadout.isEmpty()) {
                loadouts.remove(caller);
            }
            log.debug("卸下 {} {} <- {}", caller, category, itemId);
            publisher.publishEvent(new CosmeticNotifications.ItemUnequipped(caller, category, itemId, now()));
        });
    }

    @Override
    public void transfer(AccountId caller, AccountId to, long itemId, long amount) {
        sequencer.execute(() -> {
            SystemAccounts.requireUserAccount(caller, "转出方");
            SystemAccounts.requireUserAccount(to, "接收方");
            moveUnits(caller, to, itemId, amount);
            log.info("转移物品 {} x{}：{} -> {}", itemId, amount, caller, to);
            publisher.publishEvent(new CosmeticNotifications.ItemTransferred(caller, to, itemId, amount, now()));
        });
    }

    @Override
    public void moveUnits(AccountId from, AccountId to, long itemId, long amount) {
        sequencer.execute(() -> {
            require(itemId);
            checkAmount(amount);
            long fromBalance = balance(from, itemId);
            if (fromBalance < amount) {
                throw new StateException(ErrorType.INSUFFICIENT_BALANCE,
                        from + " 持有物品 " + itemId + " 数量 " + fromBalance + "，需要 " + amount);
            }
            if (from.equals(to)) {
                return;
            }
            put(from, itemId, fromBalance - amount);
            credit(to, itemId, amount);
        });
    }

    @Override
    public CosmeticItem getItem(long itemId) {
        return sequencer.read(() -> {
            CosmeticItem item = items.get(itemId);
            return item == null ? null : item.copy();
        });
    }

    @Override
    public long balanceOf(AccountId account, long itemId) {
        return sequencer.read(() -> balance(account, itemId));
    }

    @Override
    public Long getEquipped(AccountId account, CosmeticCategory category) {
        return sequencer.read(() -> {
            EnumMap<CosmeticCategory, Long> loadout = loadouts.get(account);
            return loadout == null ? null : loadout.get(category);
        });
    }

    @Override
    public Map<CosmeticCategory, Long> getLoadout(AccountId account) {
        return sequencer.read(() -> {
            EnumMap<CosmeticCategory, Long> loadout = loadouts.get(account);
            return loadout == null ? ImmutableMap.<CosmeticCategory, Long>of() : ImmutableMap.copyOf(loadout);
        });
    }

    @Override
    public boolean isEquipValid(AccountId account, CosmeticCategory category) {
        return sequencer.read(() -> {
            EnumMap<CosmeticCategory, Long> loadout = loadouts.get(account);
            Long itemId = loadout == null ? null : loadout.get(category);
            return itemId != null && balance(account, itemId) > 0;
        });
    }

    @Override
    public long itemCount() {
        return sequencer.read(() -> (long) items.size());
    }

    private CosmeticItem require(long itemId) {
        CosmeticItem item = items.get(itemId);
        if (item == null) {
            throw new StateException(ErrorType.NOT_FOUND, "物品 " + itemId);
        }
        return item;
    }

    private static void checkAmount(long amount) {
        if (amount <= 0) {
            throw new ValidationException(ErrorType.INVALID_AMOUNT, "数量必须大于0：" + amount);
        }
    }

    private long balance(AccountId account, long itemId) {
        Map<Long, Long> owned = holdings.get(account);
        return owned == null ? 0L : owned.getOrDefault(itemId, 0L);
    }

    private void credit(AccountId account, long itemId, long amount) {
        long balance;
        try {
            balance = Math.addExact(balance(account, itemId), amount);
        } catch (ArithmeticException e) {
            throw new ValidationException(ErrorType.AMOUNT_OVERFLOW, account + " 持有量溢出");
        }
        put(account, itemId, balance);
    }

    private void put(AccountId account, long itemId, long balance) {
        Map<Long, Long> owned = holdings.computeIfAbsent(account, k -> new HashMap<>());
        if (balance == 0) {
            owned.remove(itemId);
            if (owned.isEmpty()) {
                holdings.remove(account);
            }
        } else {
            owned.put(itemId, balance);
        }
    }

    private long now() {
        return clock.instant().getEpochSecond();
    }
}
