package com.trading.sdg.api;

import java.util.Locale;
import java.util.Map;

/**
 * Identity of one asset of the universe, used by asset-reference nodes.
 */
public record AssetDescriptor(String id, String ticker, String assetClass, String sector, String industry,
        String baseCurrency, String counterCurrency) {

    public AssetDescriptor {
        if (id == null || id.isEmpty())
            throw new IllegalArgumentException("Asset id is required");
    }

    /**
     * Derives identity from an id of the form {@code TICKER-Class}, e.g.
     * {@code AAPL-Stock}. Pair tickers such as {@code EURUSD-FX} also get base
     * and counter currencies.
     */
    public static AssetDescriptor fromId(String id) {
        int dash = id.lastIndexOf('-');
        String ticker = dash > 0 ? id.substring(0, dash) : id;
        String cls = dash > 0 ? id.substring(dash + 1) : null;
        String base = null, counter = null;
        if (ticker.length() == 6 && ticker.chars().allMatch(Character::isLetter)
                && ticker.equals(ticker.toUpperCase(Locale.ROOT)) && cls != null
                && (cls.equalsIgnoreCase("FX") || cls.equalsIgnoreCase("Crypto"))) {
            base = ticker.substring(0, 3);
            counter = ticker.substring(3);
        }
        return new AssetDescriptor(id, ticker, cls, null, null, base, counter);
    }

    /**
     * Whether every non-empty filter matches (case-insensitive). Recognised keys:
     * {@code ticker}, {@code asset_class}, {@code sector}, {@code industry},
     * {@code base_currency}, {@code counter_currency}. Unknown keys never match.
     */
    public boolean matches(Map<String, String> filters) {
        for (var e : filters.entrySet()) {
            String wanted = e.getValue();
            if (wanted == null || wanted.isEmpty())
                continue;
            String actual = switch (e.getKey()) {
                case "ticker" -> ticker;
                case "asset_class" -> assetClass;
                case "sector" -> sector;
                case "industry" -> industry;
                case "base_currency" -> baseCurrency;
                case "counter_currency" -> counterCurrency;
                default -> null;
            };
            if (actual == null || !actual.equalsIgnoreCase(wanted))
                return false;
        }
        return true;
    }
}
