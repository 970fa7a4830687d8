package tw.gc.auto.token.trader.strategy;

import tw.gc.auto.token.trader.entities.TokenMeta;

import java.util.List;

/**
 * External model that scores a token and recommends an action with a confidence in [0, 1].
 */
public interface TokenScoringModel {

    /**
     * @param meta discovery metadata when known, otherwise null
     */
    ModelVerdict evaluate(String mint, TokenMeta meta, List<Double> prices, boolean held);
}
