package com.worldhub.tradeservice.trade.application;

import com.worldhub.tradeservice.config.TradeProperties;
import com.worldhub.tradeservice.support.InMemoryCurrencyStore;
import com.worldhub.tradeservice.support.InMemoryInventoryStore;
import com.worldhub.tradeservice.support.InMemoryPlayerDirectory;
import com.worldhub.tradeservice.trade.domain.TradeException;
import com.worldhub.tradeservice.trade.domain.enums.TradeError;
import com.worldhub.tradeservice.trade.domain.model.OfferedItem;
import com.worldhub.tradeservice.trade.domain.model.TradeOffer;
import com.worldhub.tradeservice.trade.domain.model.TradeSession;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class OfferValidatorTest {

    private InMemoryInventoryStore inventory;
    private InMemoryCurrencyStore currency;
    private OfferValidator validator;

    @BeforeEach
    public void setUp() {
        inventory = new InMemoryInventoryStore();
        currency = new InMemoryCurrencyStore();
        InMemoryPlayerDirectory directory = new InMemoryPlayerDirectory();
        directory.register("u1", "Alice");
        directory.register("u2", "Bob");
        validator = new OfferValidator(inventory, currency, directory, new TradeProperties());
    }

    @Test
    public void shouldAcceptItemWithinLiveQuantity() {
        inventory.put("u1", 3, 42, 5);

        OfferedItem item = validator.checkItem("u1", new TradeOffer(), 3, 5);

        Assertions.assertEquals(new OfferedItem(3, 42, 5), item);
    }

    @Test
    public void shouldRejectQuantityAboveSlotContent() {
        inventory.put("u1", 3, 42, 3);

        TradeException e = Assertions.assertThrows(TradeException.class,
                () -> validator.checkItem("u1", new TradeOffer(), 3, 5));

        Assertions.assertEquals(TradeError.INVALID_OFFER, e.getError());
    }

    @Test
    public void shouldRejectEmptySlotAndOutOfRangeSlot() {
        Assertions.assertEquals(TradeError.INVALID_OFFER, Assertions.assertThrows(TradeException.class,
                () -> validator.checkItem("u1", new TradeOffer(), 4, 1)).getError());
        Assertions.assertEquals(TradeError.INVALID_OFFER, Assertions.assertThrows(TradeException.class,
                () -> validator.checkItem("u1", new TradeOffer(), 0, 1)).getError());
        Assertions.assertEquals(TradeError.INVALID_OFFER, Assertions.assertThrows(TradeException.class,
                () -> validator.checkItem("u1", new TradeOffer(), 31, 1)).getError());
    }

    @Test
    public void shouldRejectSlotWhoseItemChangedSinceOffered() {
        TradeOffer offer = new TradeOffer();
        offer.put(new OfferedItem(3, 42, 1));
        inventory.put("u1", 3, 77, 5);

        TradeException e = Assertions.assertThrows(TradeException.class,
                () -> validator.checkItem("u1", offer, 3, 2));

        Assertions.assertEquals(TradeError.INVALID_OFFER, e.getError());
    }

    @Test
    public void shouldRejectGoldAboveBalance() {
        currency.setGold("u1", 100);

        validator.checkGold("u1", 100);
        TradeException e = Assertions.assertThrows(TradeException.class, () -> validator.checkGold("u1", 101));

        Assertions.assertEquals(TradeError.INSUFFICIENT_GOLD, e.getError());
    }

    @Test
    public void shouldNameParticipantWhenRevalidationFails() {
        TradeSession session = new TradeSession("u1", "Alice", "u2", "Bob", 1000L);
        inventory.put("u2", 1, 9, 2);
        session.getTargetOffer().put(new OfferedItem(1, 9, 2));
        inventory.clearSlot("u2", 1);

        TradeException e = Assertions.assertThrows(TradeException.class, () -> validator.revalidate(session));

        Assertions.assertEquals(TradeError.VALIDATION_STALE, e.getError());
        Assertions.assertTrue(e.getMessage().contains("Bob"));
    }

    @Test
    public void shouldFailRevalidationWhenGoldWasSpent() {
        TradeSession session = new TradeSession("u1", "Alice", "u2", "Bob", 1000L);
        currency.setGold("u1", 100);
        session.getInitiatorOffer().setGold(80);
        currency.setGold("u1", 50);

        TradeException e = Assertions.assertThrows(TradeException.class, () -> validator.revalidate(session));

        Assertions.assertEquals(TradeError.VALIDATION_STALE, e.getError());
        Assertions.assertTrue(e.getMessage().contains("Alice"));
    }
}
