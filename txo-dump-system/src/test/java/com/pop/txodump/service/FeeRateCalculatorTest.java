package com.pop.txodump.service;

import com.pop.txodump.api.data.transaction.OutPoint;
import com.pop.txodump.api.data.transaction.Transaction;
import com.pop.txodump.storage.UTXOSet;
import com.pop.txodump.storage.hash.GuavaOutPointHasher;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.pop.txodump.TestBlocks.*;

public class FeeRateCalculatorTest {

    private UTXOSet utxoSet;
    private FeeRateCalculator calculator;

    @BeforeEach
    void setUp() {
        utxoSet = new UTXOSet(new GuavaOutPointHasher(), 16);
        calculator = new FeeRateCalculator(utxoSet);
    }

    @Test
    void testFeeRateTruncates() {
        utxoSet.insert(new OutPoint(txId(1), 0), 5000, 0);
        Transaction tx = tx(txId(2), 250, List.of(spend(txId(1), 0)), 4900);

        Assertions.assertEquals(100, calculator.getFee(tx));
        Assertions.assertEquals(0, calculator.getFeeRate(tx));
    }

    @Test
    void testFeeRateOverMultipleInputs() {
        utxoSet.insert(new OutPoint(txId(1), 0), 30_000, 0);
        utxoSet.insert(new OutPoint(txId(1), 1), 20_000, 0);
        Transaction tx = tx(txId(2), 200, List.of(spend(txId(1), 0), spend(txId(1), 1)), 45_000, 999);

        Assertions.assertEquals(4001, calculator.getFee(tx));
        Assertions.assertEquals(20, calculator.getFeeRate(tx));
    }

    @Test
    void testCoinbaseAndUnknownInputsCountAsZero() {
        utxoSet.insert(new OutPoint(txId(1), 0), 1000, 0);
        Transaction tx = tx(txId(2), 10, List.of(coinbaseInput(), spend(txId(9), 0), spend(txId(1), 0)), 900);

        Assertions.assertEquals(100, calculator.getFee(tx));
        Assertions.assertEquals(10, calculator.getFeeRate(tx));
    }

    @Test
    void testNegativeFeeClampsToZero() {
        Transaction coinbase = coinbase(txId(3), 5_000_000_000L);
        Assertions.assertEquals(0, calculator.getFee(coinbase));
        Assertions.assertEquals(0, calculator.getFeeRate(coinbase));
    }

    @Test
    void testZeroSizeGivesZeroRate() {
        utxoSet.insert(new OutPoint(txId(1), 0), 1000, 0);
        Transaction tx = tx(txId(2), 0, List.of(spend(txId(1), 0)), 1);
        Assertions.assertEquals(999, calculator.getFee(tx));
        Assertions.assertEquals(0, calculator.getFeeRate(tx));
    }
}
