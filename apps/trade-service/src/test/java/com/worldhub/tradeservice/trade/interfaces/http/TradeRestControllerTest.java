package com.worldhub.tradeservice.trade.interfaces.http;

import com.worldhub.tradeservice.common.ApiResponse;
import com.worldhub.tradeservice.common.WebExceptionAdvice;
import com.worldhub.tradeservice.support.InMemoryReconciliationJournal;
import com.worldhub.tradeservice.trade.domain.TradeException;
import com.worldhub.tradeservice.trade.domain.model.ReconciliationRecord;
import com.worldhub.tradeservice.trade.domain.model.TradeSession;
import com.worldhub.tradeservice.trade.domain.model.TradeSnapshot;
import com.worldhub.tradeservice.trade.service.TradeService;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.oauth2.jwt.Jwt;

import java.util.List;
import java.util.Optional;

public class TradeRestControllerTest {

    private final TradeService tradeService = Mockito.mock(TradeService.class);
    private final InMemoryReconciliationJournal journal = new InMemoryReconciliationJournal();
    private final TradeRestController controller = new TradeRestController(tradeService, journal);
    private final WebExceptionAdvice advice = new WebExceptionAdvice();

    @Test
    public void shouldReturnSnapshotOfCaller() {
        TradeSession session = new TradeSession("u1", "Alice", "u2", "Bob", 1000L);
        Mockito.when(tradeService.snapshot("u1")).thenReturn(Optional.of(TradeSnapshot.of(session)));

        ResponseEntity<ApiResponse<TradeSnapshot>> resp = controller.me(jwt("u1"));

        Assertions.assertEquals(HttpStatus.OK, resp.getStatusCode());
        Assertions.assertEquals(session.getTradeId(), resp.getBody().data().tradeId());
    }

    @Test
    public void shouldMapMissingSessionToNotFound() {
        Mockito.when(tradeService.snapshot("u1")).thenReturn(Optional.empty());

        TradeException e = Assertions.assertThrows(TradeException.class, () -> controller.me(jwt("u1")));
        ResponseEntity<ApiResponse<Object>> resp = advice.trade(e);

        Assertions.assertEquals(HttpStatus.NOT_FOUND, resp.getStatusCode());
        Assertions.assertEquals(404, resp.getBody().code());
    }

    @Test
    public void shouldListReconciliationRecordsWithinLimit() {
        journal.append(new ReconciliationRecord("t1", "u1", "u2", "背包空间不足", List.of("归还金币: user=u1"), 1L));

        Assertions.assertEquals(1, controller.reconciliation(20).getBody().data().size());
        Assertions.assertThrows(IllegalArgumentException.class, () -> controller.reconciliation(0));
    }

    private static Jwt jwt(String subject) {
        return Jwt.withTokenValue("t").header("alg", "none").subject(subject).build();
    }
}
