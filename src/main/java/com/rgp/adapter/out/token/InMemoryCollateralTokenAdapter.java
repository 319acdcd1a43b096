package com.rgp.adapter.out.token;

import com.rgp.adapter.out.persistence.SnapshotParticipant;
import com.rgp.application.port.out.CollateralToken;
import lombok.extern.slf4j.Slf4j;

import java.math.BigInteger;
import java.util.HashMap;
import java.util.Map;

/**
 * In-memory collateral asset.
 * Refuses (returns false) any movement the source balance cannot cover.
 */
@Slf4j
public class InMemoryCollateralTokenAdapter implements CollateralToken, SnapshotParticipant<Map<String, BigInteger>> {

    private Map<String, BigInteger> balances = new HashMap<>();

    public void mint(String account, BigInteger amount) {
        if (amount.signum() <= 0) {
            throw new IllegalArgumentException("mint amount must be positive");
        }
        balances.merge(account, amount, BigInteger::add);
        log.info("Minted {} collateral to {}", amount, account);
    }

    @Override
    public boolean transferFrom(String from, String to, BigInteger amount) {
        return move(from, to, amount);
    }

    @Override
    public boolean transfer(String from, String to, BigInteger amount) {
        return move(from, to, amount);
    }

    @Override
    public BigInteger balanceOf(String account) {
        return balances.getOrDefault(account, BigInteger.ZERO);
    }

    private boolean move(String from, String to, BigInteger amount) {
        if (amount.signum() < 0 || from.equals(to)) {
            return false;
        }
        BigInteger balance = balanceOf(from);
        if (balance.compareTo(amount) < 0) {
            log.warn("Refused transfer of {} from {} (balance {})", amount, from, balance);
            return false;
        }
        balances.put(from, balance.subtract(amount));
        balances.merge(to, amount, BigInteger::add);
        return true;
    }

    @Override
    public Map<String, BigInteger> snapshot() {
        return new HashMap<>(balances);
    }

    @Override
    public void restore(Map<String, BigInteger> snapshot) {
        balances = snapshot;
    }
}
