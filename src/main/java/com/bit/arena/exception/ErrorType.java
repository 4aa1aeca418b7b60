package com.bit.arena.exception;

public enum ErrorType {
    // ---------- 签名授权 ----------
    SIGNATURE_EXPIRED(ErrorCategory.AUTHORIZATION, "签名已过期", true),
    INVALID_SIGNER(ErrorCategory.AUTHORIZATION, "签名者不是受信任的后端签名者", false),
    INVALID_SIGNATURE(ErrorCategory.AUTHORIZATION, "签名无效", false),

    // ---------- 状态 ----------
    ALREADY_EXISTS(ErrorCategory.STATE, "记录已存在", false),
    NOT_FOUND(ErrorCategory.STATE, "记录不存在", false),
    ALREADY_REGISTERED(ErrorCategory.STATE, "账户已注册档案", false),
    NOT_REGISTERED(ErrorCategory.STATE, "账户未注册档案", false),
    ALREADY_HAS_ACHIEVEMENT(ErrorCategory.STATE, "该活动成就已领取", false),
    LISTING_NOT_ACTIVE(ErrorCategory.STATE, "挂单不是进行中状态", false),
    ITEM_NOT_OWNED(ErrorCategory.STATE, "未持有该物品", false),
    ITEM_NOT_EQUIPPED(ErrorCategory.STATE, "该槽位未装备物品", false),
    INSUFFICIENT_BALANCE(ErrorCategory.STATE, "物品数量不足", false),

    // ---------- 参数校验 ----------
    INVALID_TIER(ErrorCategory.VALIDATION, "等级超出范围", false),
    INVALID_REWARD_TIER(ErrorCategory.VALIDATION, "奖励成就等级超出范围", false),
    INVALID_FEE(ErrorCategory.VALIDATION, "平台费率超过上限", false),
    INVALID_TIME_WINDOW(ErrorCategory.VALIDATION, "开始时间必须早于结束时间", false),
    INVALID_CATEGORY(ErrorCategory.VALIDATION, "物品类别无效", false),
    INVALID_RARITY(ErrorCategory.VALIDATION, "物品稀有度无效", false),
    INVALID_AMOUNT(ErrorCategory.VALIDATION, "数量无效", false),
    INVALID_PRICE(ErrorCategory.VALIDATION, "价格无效", false),
    INVALID_CAPACITY(ErrorCategory.VALIDATION, "人数上限低于当前参与人数", false),
    AMOUNT_OVERFLOW(ErrorCategory.VALIDATION, "金额计算溢出", false),
    INVALID_ACCOUNT(ErrorCategory.VALIDATION, "账户为空或为系统账户", false),

    // ---------- 容量 ----------
    EVENT_FULL(ErrorCategory.CAPACITY, "活动人数已满", false),
    MAX_SUPPLY_REACHED(ErrorCategory.CAPACITY, "物品已达最大供应量", false),

    // ---------- 权限 ----------
    UNAUTHORIZED(ErrorCategory.ACCESS, "无权限执行该操作", false),
    NOT_SELLER(ErrorCategory.ACCESS, "只有卖家可以操作该挂单", false),
    NOT_EVENT_MANAGER(ErrorCategory.ACCESS, "只有活动管理员可以操作", false),

    // ---------- 结算 ----------
    INSUFFICIENT_PAYMENT(ErrorCategory.SETTLEMENT, "支付金额不足", false),
    TRANSFER_FAILED(ErrorCategory.SETTLEMENT, "资金划转失败", true);

    private final ErrorCategory category;
    private final String desc;
    // 调用方是否可以换新签名/新参数后重新提交
    private final boolean retryable;

    ErrorType(ErrorCategory category, String desc, boolean retryable) {
        this.category = category;
        this.desc = desc;
        this.retryable = retryable;
    }

    public ErrorCategory getCategory() {
        return category;
    }

    public String getDesc() {
        return desc;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
