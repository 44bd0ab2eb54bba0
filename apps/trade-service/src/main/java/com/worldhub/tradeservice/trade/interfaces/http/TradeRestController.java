package com.worldhub.tradeservice.trade.interfaces.http;

import com.worldhub.tradeservice.common.ApiResponse;
import com.worldhub.tradeservice.trade.domain.TradeException;
import com.worldhub.tradeservice.trade.domain.constants.TradeMessages;
import com.worldhub.tradeservice.trade.domain.enums.TradeError;
import com.worldhub.tradeservice.trade.domain.model.ReconciliationRecord;
import com.worldhub.tradeservice.trade.domain.model.TradeSnapshot;
import com.worldhub.tradeservice.trade.domain.repository.ReconciliationJournal;
import com.worldhub.tradeservice.trade.service.TradeService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * 交易查询接口
 * - /me：当前用户的交易快照
 * - /reconciliation：回滚失败待人工处理的记录（运维查看）
 */
@RestController
@RequestMapping("/api/trade")
@RequiredArgsConstructor
public class TradeRestController {

    private static final int MAX_RECONCILIATION_LIMIT = 200;

    private final TradeService tradeService;
    private final ReconciliationJournal reconciliationJournal;

    /**
     * 当前用户正在进行的交易快照；不在交易中返回 404
     */
    @GetMapping("/me")
    public ResponseEntity<ApiResponse<TradeSnapshot>> me(@AuthenticationPrincipal Jwt jwt) {
        TradeSnapshot snapshot = tradeService.snapshot(jwt.getSubject())
                .orElseThrow(() -> new TradeException(TradeError.NO_SESSION, TradeMessages.NO_SESSION));
        return ResponseEntity.ok(ApiResponse.success(snapshot));
    }

    @GetMapping("/reconciliation")
    public ResponseEntity<ApiResponse<List<ReconciliationRecord>>> reconciliation(
            @RequestParam(defaultValue = "20") int limit) {
        if (limit <= 0 || limit > MAX_RECONCILIATION_LIMIT) {
            throw new IllegalArgumentException("limit 取值范围为 1.." + MAX_RECONCILIATION_LIMIT);
        }
        return ResponseEntity.ok(ApiResponse.success(reconciliationJournal.recent(limit)));
    }
}
