package com.defiguard.exception;

/**
 * Wallet input or signing failure. Messages never carry key material or echo the
 * rejected input.
 */
public class WalletException extends BaseException {

    public WalletException(String message) {
        super(ErrorCode.WALLET_ERROR, message);
    }
}
