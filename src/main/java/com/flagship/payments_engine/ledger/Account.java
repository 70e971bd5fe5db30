package com.flagship.payments_engine.ledger;

import com.flagship.payments_engine.money.Amount;
import lombok.Value;

/**
 * State of one client account.
 *
 * Key principles:
 * - total is carried alongside available and held and updated by every transition,
 *   so any drift from {@code available + held} is caught when the new state is built
 * - invalid transitions are rejected with {@link IllegalStateException}
 * - state changes are immutable (each transition returns a new Account), so an Account
 *   handed out in a snapshot can never observe later mutations
 */
@Value
public class Account {
    int clientId;
    Amount available;
    Amount held;
    Amount total;
    boolean locked;

    private Account(int clientId, Amount available, Amount held, Amount total, boolean locked) {
        if (!available.add(held).equals(total)) {
            throw new IllegalStateException(
                String.format("Account %d out of balance: available=%s, held=%s, total=%s",
                    clientId, available, held, total));
        }
        this.clientId = clientId;
        this.available = available;
        this.held = held;
        this.total = total;
        this.locked = locked;
    }

    /**
     * Creates an empty, unlocked account.
     */
    public static Account open(int clientId) {
        return new Account(clientId, Amount.ZERO, Amount.ZERO, Amount.ZERO, false);
    }

    /**
     * Credits available funds.
     *
     * @throws IllegalStateException if the account is locked
     */
    public Account deposit(Amount amount) {
        requireUnlocked("deposit");
        return new Account(clientId, available.add(amount), held, total.add(amount), locked);
    }

    /**
     * Debits available funds.
     *
     * @throws IllegalStateException if the account is locked or available funds are insufficient
     */
    public Account withdraw(Amount amount) {
        requireUnlocked("withdraw from");
        if (!canCover(amount)) {
            throw new IllegalStateException(
                String.format("Cannot withdraw %s from account %d with %s available",
                    amount, clientId, available));
        }
        return new Account(clientId, available.subtract(amount), held, total.subtract(amount), locked);
    }

    /**
     * Moves funds from available to held. Total is unchanged.
     */
    public Account hold(Amount amount) {
        return new Account(clientId, available.subtract(amount), held.add(amount), total, locked);
    }

    /**
     * Moves held funds back to available. Total is unchanged.
     */
    public Account release(Amount amount) {
        return new Account(clientId, available.add(amount), held.subtract(amount), total, locked);
    }

    /**
     * Removes held funds permanently and locks the account.
     */
    public Account chargeBack(Amount amount) {
        return new Account(clientId, available, held.subtract(amount), total.subtract(amount), true);
    }

    public boolean canCover(Amount amount) {
        return !available.isLessThan(amount);
    }

    private void requireUnlocked(String operation) {
        if (locked) {
            throw new IllegalStateException(
                String.format("Cannot %s account %d: account is locked", operation, clientId));
        }
    }
}
