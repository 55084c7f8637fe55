package com.cashflow.engine;

import com.cashflow.model.GameState;
import com.cashflow.model.Player;
import com.cashflow.model.TurnPhase;
import com.cashflow.model.asset.Asset;
import com.cashflow.model.asset.BusinessAsset;
import com.cashflow.model.asset.RealEstateAsset;
import com.cashflow.model.asset.StockAsset;
import com.cashflow.model.card.BusinessDeal;
import com.cashflow.model.card.DealCard;
import com.cashflow.model.card.DoodadCard;
import com.cashflow.model.card.MarketCard;
import com.cashflow.model.card.MarketEffect;
import com.cashflow.model.card.RealEstateDeal;
import com.cashflow.model.card.StockDeal;
import com.cashflow.model.card.StockSplitDeal;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Applies card effects to a game state. Never changes whose turn it is.
 */
public class CardResolver {

    private final Clock clock;

    public CardResolver(Clock clock) {
        this.clock = clock;
    }

    // ── deals ───────────────────────────────────────────────────────────

    /**
     * Buys the deal on {@code card} for {@code playerId}.
     * With {@code skipPayment} the asset is transferred without touching cash.
     * Stock purchases of an already held symbol merge into the existing holding.
     */
    public GameState buyDeal(GameState state, DealCard card, String playerId, Integer shares, boolean skipPayment) {
        int index = state.indexOf(playerId);
        if (index < 0) {
            return state;
        }
        Player player = state.getPlayers().get(index);

        if (card.deal() instanceof StockDeal deal) {
            int count = shares == null ? 1 : shares;
            int cost = stockCost(deal.costPerShare(), count);
            if (!skipPayment && player.getCash() < cost) {
                return log(state, playerId, "Cannot afford " + count + " shares of " + deal.symbol() + " ($" + cost + ")");
            }

            var existing = player.getFinancialStatement().findStock(deal.symbol());
            if (existing.isPresent()) {
                StockAsset held = existing.get();
                player = player.withFinancialStatement(
                        player.getFinancialStatement().replaceAsset(held.withShares(held.shares() + count)));
            } else {
                String assetId = assetId(state);
                state = state.toBuilder().nextAssetId(state.getNextAssetId() + 1).build();
                player = player.withFinancialStatement(player.getFinancialStatement().withAsset(
                        new StockAsset(assetId, deal.name(), deal.symbol(), count,
                                deal.costPerShare(), deal.dividendPerShare())));
            }
            if (!skipPayment) {
                player = player.withCash(player.getCash() - cost);
            }
            return log(state.withPlayer(index, player), playerId,
                    "Bought " + count + " shares of " + deal.symbol() + " at $" + price(deal.costPerShare()) + "/share");
        }

        if (card.deal() instanceof RealEstateDeal deal) {
            if (!skipPayment && player.getCash() < deal.downPayment()) {
                return log(state, playerId, "Cannot afford down payment of $" + deal.downPayment() + " for " + deal.name());
            }
            Asset asset = new RealEstateAsset(assetId(state), deal.name(), deal.subType(), deal.cost(),
                    deal.mortgage(), deal.downPayment(), deal.cashFlow());
            return addProperty(state, index, player, asset, deal.downPayment(), deal.cashFlow(), skipPayment);
        }

        if (card.deal() instanceof BusinessDeal deal) {
            if (!skipPayment && player.getCash() < deal.downPayment()) {
                return log(state, playerId, "Cannot afford down payment of $" + deal.downPayment() + " for " + deal.name());
            }
            Asset asset = new BusinessAsset(assetId(state), deal.name(), deal.cost(),
                    deal.mortgage(), deal.downPayment(), deal.cashFlow());
            return addProperty(state, index, player, asset, deal.downPayment(), deal.cashFlow(), skipPayment);
        }

        // stock splits resolve on draw and are never bought
        return state;
    }

    private GameState addProperty(GameState state, int index, Player player, Asset asset,
                                  int downPayment, int cashFlow, boolean skipPayment) {
        Player updated = player.withFinancialStatement(player.getFinancialStatement().withAsset(asset));
        if (!skipPayment) {
            updated = updated.withCash(updated.getCash() - downPayment);
        }
        GameState next = state.toBuilder().nextAssetId(state.getNextAssetId() + 1).build().withPlayer(index, updated);
        return log(next, player.getId(),
                "Bought " + asset.name() + " for $" + downPayment + " down (cash flow: $" + cashFlow + "/mo)");
    }

    /**
     * Splits or reverse-splits every holding of the card's symbol across all players.
     * Holdings that round down to zero shares are removed.
     */
    public GameState stockSplit(GameState state, StockSplitDeal split) {
        GameState next = state;
        for (int i = 0; i < next.getPlayers().size(); i++) {
            Player player = next.getPlayers().get(i);
            List<Asset> assets = new ArrayList<>();
            boolean affected = false;

            for (Asset asset : player.getFinancialStatement().getAssets()) {
                if (asset instanceof StockAsset stock && stock.symbol().equals(split.symbol())) {
                    affected = true;
                    int newShares = (int) Math.floor(stock.shares() * split.splitRatio());
                    if (newShares > 0) {
                        assets.add(new StockAsset(stock.id(), stock.name(), stock.symbol(), newShares,
                                stock.costPerShare() / split.splitRatio(),
                                stock.dividendPerShare() / split.splitRatio()));
                    }
                } else {
                    assets.add(asset);
                }
            }

            if (affected) {
                next = next.withPlayer(i, player.withFinancialStatement(player.getFinancialStatement().withAssets(assets)));
                next = log(next, player.getId(), split.splitRatio() >= 1
                        ? "Stock split! " + split.symbol() + " shares multiplied by " + price(split.splitRatio())
                        : "Reverse stock split! " + split.symbol() + " shares multiplied by " + price(split.splitRatio()));
            }
        }
        return next;
    }

    // ── market ──────────────────────────────────────────────────────────

    /**
     * Applies a market card. Sale offers leave the turn in {@link TurnPhase#MAKE_DECISION};
     * expenses are charged at once and move the turn to {@link TurnPhase#END_OF_TURN}.
     */
    public GameState resolveMarket(GameState state, MarketCard card) {
        MarketEffect effect = card.effect();
        String currentId = state.currentPlayer().getId();

        if (effect instanceof MarketEffect.DamageToProperty damage) {
            GameState next = state;
            for (int i = 0; i < next.getPlayers().size(); i++) {
                Player p = next.getPlayers().get(i);
                boolean owns = p.getFinancialStatement().getAssets().stream()
                        .anyMatch(a -> a instanceof RealEstateAsset re && damage.subTypes().contains(re.subType()));
                if (owns) {
                    next = next.withPlayer(i, p.withCash(p.getCash() - damage.cost()));
                    next = log(next, p.getId(), "Paid $" + damage.cost() + " for property damage: " + card.title());
                    next = applyForcedLoan(next, i);
                }
            }
            return next.withPhase(TurnPhase.END_OF_TURN);
        }

        if (effect instanceof MarketEffect.AllPlayersExpense expense) {
            GameState next = state;
            for (int i = 0; i < next.getPlayers().size(); i++) {
                Player p = next.getPlayers().get(i);
                if (p.isBankrupt()) {
                    continue;
                }
                next = next.withPlayer(i, p.withCash(p.getCash() - expense.amount()));
                next = log(next, p.getId(), "Paid $" + expense.amount() + ": " + card.title());
                next = applyForcedLoan(next, i);
            }
            return next.withPhase(TurnPhase.END_OF_TURN);
        }

        return log(state.withPhase(TurnPhase.MAKE_DECISION), currentId,
                "Market: " + card.title() + " - " + effect.description());
    }

    public static boolean immediate(MarketEffect effect) {
        return effect instanceof MarketEffect.DamageToProperty || effect instanceof MarketEffect.AllPlayersExpense;
    }

    /**
     * Whether {@code asset} can be sold under the given market effect.
     */
    public static boolean sellable(Asset asset, MarketEffect effect) {
        if (asset instanceof StockAsset stock && effect instanceof MarketEffect.StockPriceChange change) {
            return stock.symbol().equals(change.symbol());
        }
        if (asset instanceof RealEstateAsset re) {
            if (effect instanceof MarketEffect.RealEstateOffer offer) {
                return offer.subTypes().contains(re.subType());
            }
            if (effect instanceof MarketEffect.RealEstateOfferFlat offer) {
                return offer.subTypes().contains(re.subType());
            }
        }
        return false;
    }

    /**
     * Sells one asset at the active market card's price.
     * Real estate pays the sale price minus the mortgage; stock pays price times shares.
     */
    public GameState sellToMarket(GameState state, MarketCard card, String playerId, String assetId) {
        int index = state.indexOf(playerId);
        if (index < 0) {
            return state;
        }
        Player player = state.getPlayers().get(index);
        Asset asset = player.getFinancialStatement().findAsset(assetId).orElse(null);
        if (asset == null || !sellable(asset, card.effect())) {
            return state;
        }

        MarketEffect effect = card.effect();
        Player seller = player.withFinancialStatement(player.getFinancialStatement().withoutAsset(assetId));

        if (asset instanceof RealEstateAsset re) {
            int salePrice = effect instanceof MarketEffect.RealEstateOffer offer
                    ? (int) Math.floor(re.cost() * offer.offerMultiplier())
                    : ((MarketEffect.RealEstateOfferFlat) effect).offerAmount();
            int proceeds = salePrice - re.mortgage();
            seller = seller.withCash(seller.getCash() + proceeds);
            GameState next = log(state.withPlayer(index, seller), playerId,
                    "Sold " + re.name() + " for $" + salePrice + " (after mortgage: $" + proceeds + ")");
            // an offer below the mortgage leaves the shortfall to cover
            return applyForcedLoan(next, index);
        }

        StockAsset stock = (StockAsset) asset;
        double newPrice = ((MarketEffect.StockPriceChange) effect).newPrice();
        int proceeds = (int) Math.floor(newPrice * stock.shares());
        seller = seller.withCash(seller.getCash() + proceeds);
        return log(state.withPlayer(index, seller), playerId,
                "Sold " + stock.shares() + " shares of " + stock.symbol() + " at $" + price(newPrice) + "/share ($" + proceeds + ")");
    }

    /**
     * Sells some or all shares of a holding at a fixed price per share.
     */
    public GameState sellStock(GameState state, String playerId, String assetId, double pricePerShare, Integer shares) {
        int index = state.indexOf(playerId);
        if (index < 0) {
            return state;
        }
        Player player = state.getPlayers().get(index);
        Asset asset = player.getFinancialStatement().findAsset(assetId).orElse(null);
        if (!(asset instanceof StockAsset stock)) {
            return state;
        }
        int count = shares == null ? stock.shares() : shares;
        if (count <= 0 || count > stock.shares()) {
            return state;
        }

        int proceeds = (int) Math.floor(pricePerShare * count);
        var statement = count == stock.shares()
                ? player.getFinancialStatement().withoutAsset(assetId)
                : player.getFinancialStatement().replaceAsset(stock.withShares(stock.shares() - count));
        Player seller = player.toBuilder()
                .financialStatement(statement)
                .cash(player.getCash() + proceeds)
                .build();
        return log(state.withPlayer(index, seller), playerId,
                "Sold " + count + " shares of " + stock.symbol() + " at $" + price(pricePerShare) + "/share ($" + proceeds + ")");
    }

    // ── doodads ─────────────────────────────────────────────────────────

    public static int doodadCost(DoodadCard card, Player player) {
        if (card.percentOfIncome()) {
            return (int) Math.floor(FinancialCalculator.totalIncome(player.getFinancialStatement()) * card.cost() / 100.0);
        }
        return card.cost();
    }

    /**
     * Charges the doodad to the player. Cash may go negative; callers apply the forced loan.
     */
    public GameState payDoodad(GameState state, DoodadCard card, String playerId) {
        int index = state.indexOf(playerId);
        if (index < 0) {
            return state;
        }
        Player player = state.getPlayers().get(index);
        int cost = doodadCost(card, player);
        return log(state.withPlayer(index, player.withCash(player.getCash() - cost)), playerId,
                "Paid $" + cost + " for " + card.title());
    }

    // ── helpers ─────────────────────────────────────────────────────────

    /**
     * Runs the forced-loan procedure on one player and logs any amount borrowed.
     */
    public GameState applyForcedLoan(GameState state, int index) {
        FinancialCalculator.LoanResult result = FinancialCalculator.forcedLoan(state.getPlayers().get(index));
        if (result.amountBorrowed() == 0) {
            return state;
        }
        Player updated = result.player();
        return log(state.withPlayer(index, updated), updated.getId(),
                "Forced bank loan of $" + result.amountBorrowed() + " (cash was negative). Monthly payment: $"
                        + FinancialCalculator.bankLoanPayment(updated.getBankLoanAmount()));
    }

    public GameState log(GameState state, String playerId, String message) {
        return state.withLog(playerId, message, clock.millis());
    }

    static int stockCost(double costPerShare, int shares) {
        return (int) Math.ceil(costPerShare * shares);
    }

    private static String assetId(GameState state) {
        return "asset-" + state.getNextAssetId();
    }

    private static String price(double value) {
        return value == Math.rint(value) ? String.valueOf((long) value) : String.valueOf(value);
    }
}
