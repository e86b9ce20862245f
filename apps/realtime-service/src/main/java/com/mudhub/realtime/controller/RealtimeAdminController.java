package com.mudhub.realtime.controller;

import com.mudhub.realtime.bus.BrokerBridge;
import com.mudhub.realtime.bus.LocationMembershipSync;
import com.mudhub.realtime.bus.LocationSubscriptionTracker;
import com.mudhub.realtime.dispatch.SendOutcome;
import com.mudhub.realtime.dispatch.SendReceipt;
import com.mudhub.realtime.dispatch.SendResult;
import com.mudhub.realtime.gateway.RealtimeGateway;
import com.mudhub.realtime.janitor.CleanupReport;
import com.mudhub.realtime.janitor.ConnectionJanitor;
import com.mudhub.realtime.moderation.InMemoryMuteDirectory;
import com.mudhub.realtime.pending.PendingMessageBuffer;
import com.mudhub.realtime.ratelimit.RateLimitInfo;
import com.mudhub.realtime.ratelimit.RateLimiter;
import com.mudhub.realtime.routing.ChannelKind;
import com.mudhub.realtime.routing.InMemoryWorldDirectory;
import com.mudhub.session.ConnectionRegistry;
import com.mudhub.session.model.IdentitySessionSnapshot;
import com.mudhub.web.common.ApiResponse;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 内部运维与游戏逻辑接口。
 *
 * 只供集群内部调用（由上游网关拦截外部访问），不做额外鉴权。
 */
@RestController
@RequestMapping("/internal/realtime")
@RequiredArgsConstructor
@Slf4j
public class RealtimeAdminController {

    private final RealtimeGateway gateway;
    private final ConnectionRegistry registry;
    private final PendingMessageBuffer pending;
    private final RateLimiter rateLimiter;
    private final InMemoryMuteDirectory muteDirectory;
    private final InMemoryWorldDirectory world;
    private final LocationMembershipSync locationSync;
    private final LocationSubscriptionTracker subscriptionTracker;
    private final BrokerBridge brokerBridge;
    private final ConnectionJanitor janitor;
    private final Clock clock;

    /* =========================
     * 查询
     * ========================= */

    /**
     * 玩家的连接、暂存消息数、各频道限流状态、屏蔽设置与位置。
     */
    @GetMapping("/identities/{identity}")
    public ResponseEntity<ApiResponse<IdentityReport>> identity(@PathVariable String identity) {
        if (!registry.isKnown(identity) && world.currentLocation(identity).isEmpty()) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(ApiResponse.notFound("unknown identity " + identity));
        }
        List<RateLimitInfo> rateLimits = new ArrayList<>();
        for (ChannelKind kind : ChannelKind.values()) {
            rateLimits.add(rateLimiter.info(identity, kind));
        }
        IdentityReport report = new IdentityReport(
                registry.snapshot(identity),
                pending.size(identity),
                rateLimits,
                muteDirectory.mutedSendersOf(identity),
                muteDirectory.mutedChannelsOf(identity),
                world.currentLocation(identity).orElse(null),
                subscriptionTracker.stateOf(identity));
        return ResponseEntity.ok(ApiResponse.success(report));
    }

    @GetMapping("/stats")
    public ApiResponse<Map<String, Object>> stats() {
        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("identities", registry.identityCount());
        stats.put("connections", registry.connectionCount());
        stats.put("online", registry.onlineIdentities().size());
        stats.put("pending", pending.stats());
        stats.put("rateLimiter", rateLimiter.stats());
        stats.put("broker", brokerBridge.stats());
        stats.put("janitor", janitor.stats());
        return ApiResponse.success(stats);
    }

    /* =========================
     * 运维操作
     * ========================= */

    /** 立即执行一次清理 */
    @PostMapping("/cleanup")
    public ApiResponse<CleanupReport> cleanup() {
        return ApiResponse.success(janitor.forceSweep());
    }

    @PostMapping("/identities/{identity}/disconnect")
    public ApiResponse<List<String>> disconnect(@PathVariable String identity,
                                                @RequestParam(defaultValue = "disconnected by an operator") String reason) {
        List<String> closed = gateway.disconnect(identity, reason);
        log.info("【运维】强制下线: identity={}, closed={}, reason={}", identity, closed.size(), reason);
        return ApiResponse.success(closed);
    }

    /**
     * 更新玩家位置（世界同步入口）。只改成员关系与订阅，不产生上下线通知。
     */
    @PutMapping("/identities/{identity}/location")
    public ApiResponse<Map<String, String>> moveTo(@PathVariable String identity,
                                                   @Valid @RequestBody LocationRequest request) {
        String previous = locationSync.updateLocation(identity, request.getLocationKey()).orElse(null);
        Map<String, String> body = new LinkedHashMap<>();
        body.put("previous", previous);
        body.put("current", request.getLocationKey());
        return ApiResponse.success(body);
    }

    @DeleteMapping("/identities/{identity}/location")
    public ApiResponse<String> leaveWorld(@PathVariable String identity) {
        return ApiResponse.success(locationSync.removeFromWorld(identity).orElse(null));
    }

    /** 屏蔽某个发送者 */
    @PutMapping("/identities/{identity}/mutes/{sender}")
    public ApiResponse<Boolean> mute(@PathVariable String identity, @PathVariable String sender) {
        return ApiResponse.success(muteDirectory.mute(identity, sender));
    }

    @DeleteMapping("/identities/{identity}/mutes/{sender}")
    public ApiResponse<Boolean> unmute(@PathVariable String identity, @PathVariable String sender) {
        return ApiResponse.success(muteDirectory.unmute(identity, sender));
    }

    /** 屏蔽整个频道（系统频道不可屏蔽） */
    @PutMapping("/identities/{identity}/channel-mutes/{channel}")
    public ApiResponse<Boolean> muteChannel(@PathVariable String identity, @PathVariable String channel) {
        return ApiResponse.success(muteDirectory.muteChannel(identity, ChannelKind.fromChannelName(channel)));
    }

    @DeleteMapping("/identities/{identity}/channel-mutes/{channel}")
    public ApiResponse<Boolean> unmuteChannel(@PathVariable String identity, @PathVariable String channel) {
        return ApiResponse.success(muteDirectory.unmuteChannel(identity, ChannelKind.fromChannelName(channel)));
    }

    /* =========================
     * 游戏逻辑发消息
     * ========================= */

    /**
     * 以玩家身份发送一条聊天消息（系统消息走 /system）。
     * 被限流返回 429，其余结果均为 200 并附带回执。
     */
    @PostMapping("/messages")
    public ResponseEntity<ApiResponse<SendReceipt>> send(@Valid @RequestBody SendRequest request) {
        ChannelKind kind = ChannelKind.fromChannelName(request.getChannel());
        SendResult result = gateway.send(request.getSender(), kind, request.getContent(), request.getTarget());
        return toResponse(result);
    }

    @PostMapping("/system")
    public ResponseEntity<ApiResponse<SendReceipt>> system(@Valid @RequestBody SystemRequest request) {
        return toResponse(gateway.sendSystem(request.getContent()));
    }

    private ResponseEntity<ApiResponse<SendReceipt>> toResponse(SendResult result) {
        SendReceipt receipt = SendReceipt.of(result, clock.millis());
        if (result.outcome() == SendOutcome.RATE_LIMITED) {
            return ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS)
                    .header("Retry-After", String.valueOf(receipt.retryAfterSeconds()))
                    .body(ApiResponse.error(ApiResponse.TOO_MANY_REQUESTS, receipt.message(), receipt));
        }
        return ResponseEntity.ok(ApiResponse.success(receipt));
    }

    /* =========================
     * 请求 / 响应体
     * ========================= */

    public record IdentityReport(IdentitySessionSnapshot session,
                                 int pendingMessages,
                                 List<RateLimitInfo> rateLimits,
                                 Set<String> mutedSenders,
                                 Set<ChannelKind> mutedChannels,
                                 String location,
                                 LocationSubscriptionTracker.State locationSubscription) {
    }

    @Data
    public static class LocationRequest {
        @NotBlank(message = "locationKey is required")
        private String locationKey;
    }

    @Data
    public static class SendRequest {
        @NotBlank(message = "sender is required")
        private String sender;

        /** location / broadcast / direct */
        @NotBlank(message = "channel is required")
        private String channel;

        /** 私聊目标 */
        private String target;

        @NotBlank(message = "content is required")
        private String content;
    }

    @Data
    public static class SystemRequest {
        @NotBlank(message = "content is required")
        private String content;
    }
}
