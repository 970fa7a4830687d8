package tw.gc.auto.token.trader.entities;

/**
 * A swap transaction ready for signing.
 */
public record UnsignedSwap(SwapQuote quote, String walletPublicKey, int slippageBps) {
}
