package com.bit.arena.api;

import com.bit.arena.common.AccountId;
import com.bit.arena.market.Marketplace;
import com.bit.arena.result.Result;
import com.bit.arena.structure.dto.BuyRequest;
import com.bit.arena.structure.dto.CreateListingRequest;
import com.bit.arena.structure.dto.FeeRequest;
import com.bit.arena.structure.market.Listing;
import com.bit.arena.structure.market.PriceQuote;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@Slf4j
@RestController
@RequestMapping("/market")
public class MarketplaceApi {

    @Autowired
    private Marketplace marketplace;

    @PostMapping("/list")
    public Result<Listing> createListing(@RequestHeader("X-Caller") String caller,
                                         @RequestBody CreateListingRequest request) {
        return Result.OK(marketplace.createListing(AccountId.fromHex(caller), request.getItemId(),
                request.getAmount(), request.getPricePerUnit()));
    }

    @PostMapping("/cancel")
    public Result<Listing> cancelListing(@RequestHeader("X-Caller") String caller, @RequestParam long listingId) {
        return Result.OK(marketplace.cancelListing(AccountId.fromHex(caller), listingId));
    }

    @PostMapping("/buy")
    public Result<Listing> buyItem(@RequestHeader("X-Caller") String caller, @RequestBody BuyRequest request) {
        return Result.OK(marketplace.buyItem(AccountId.fromHex(caller), request.getListingId(),
                request.getAmount(), request.getPayment()));
    }

    // 设置平台费率（ADMIN）
    @PostMapping("/fee")
    public Result<Void> setPlatformFee(@RequestHeader("X-Caller") String caller, @RequestBody FeeRequest request) {
        marketplace.setPlatformFee(AccountId.fromHex(caller), request.getFeeBps());
        return Result.OK();
    }

    // 提取手续费（ADMIN）
    @PostMapping("/withdraw")
    public Result<Long> withdrawFees(@RequestHeader("X-Caller") String caller, @RequestParam String to) {
        return Result.OK(marketplace.withdrawFees(AccountId.fromHex(caller), AccountId.fromHex(to)));
    }

    @GetMapping("/listing")
    public Result<Listing> getListing(@RequestParam long listingId) {
        return Result.OK(marketplace.getListing(listingId));
    }

    @GetMapping("/byItem")
    public Result<List<Listing>> listingsByItem(@RequestParam long itemId,
                                                @RequestParam(defaultValue = "false") boolean activeOnly) {
        return Result.OK(activeOnly ? marketplace.activeListingsByItem(itemId) : marketplace.listingsByItem(itemId));
    }

    @GetMapping("/bySeller")
    public Result<List<Listing>> listingsBySeller(@RequestParam String seller) {
        return Result.OK(marketplace.listingsBySeller(AccountId.fromHex(seller)));
    }

    @GetMapping("/quote")
    public Result<PriceQuote> quote(@RequestParam long listingId, @RequestParam long amount) {
        return Result.OK(marketplace.quote(listingId, amount));
    }

    @GetMapping("/fee")
    public Result<Integer> platformFeeBps() {
        return Result.OK(marketplace.platformFeeBps());
    }

    @GetMapping("/maxFee")
    public Result<Integer> maxPlatformFeeBps() {
        return Result.OK(marketplace.maxPlatformFeeBps());
    }

    @GetMapping("/fees")
    public Result<Long> accumulatedFees() {
        return Result.OK(marketplace.accumulatedFees());
    }
}
