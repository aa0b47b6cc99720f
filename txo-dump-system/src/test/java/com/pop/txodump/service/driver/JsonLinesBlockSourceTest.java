package com.pop.txodump.service.driver;

import com.pop.txodump.api.data.block.Block;
import com.pop.txodump.api.data.transaction.TXInput;
import com.pop.txodump.api.data.transaction.Transaction;
import com.pop.txodump.api.exception.TxoDumpException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

public class JsonLinesBlockSourceTest {

    private static final String ZERO = "00".repeat(32);
    private static final String A = "aa".repeat(32);

    @TempDir
    Path folder;

    @Test
    void testReadsBlocks() throws IOException, TxoDumpException {
        Path file = folder.resolve("blocks.jsonl");
        Files.writeString(file,
                "{\"height\":0,\"transactions\":[{\"txId\":\"" + A + "\",\"size\":120,"
                        + "\"inputs\":[{\"txId\":\"" + ZERO + "\",\"vout\":4294967295}],\"outputs\":[{\"value\":5000000000}]}]}\n"
                        + "\n"
                        + "{\"height\":1,\"transactions\":[]}\n");

        try (JsonLinesBlockSource source = new JsonLinesBlockSource(file)) {
            Block first = source.next().orElseThrow();
            Assertions.assertEquals(0, first.getHeight());
            Transaction coinbase = first.getTransactions().get(0);
            Assertions.assertEquals(32, coinbase.getTxId().length);
            Assertions.assertEquals((byte) 0xAA, coinbase.getTxId()[0]);
            Assertions.assertEquals(120, coinbase.getSize());
            TXInput input = coinbase.getInputs().get(0);
            Assertions.assertTrue(input.isCoinbase());
            Assertions.assertEquals(5_000_000_000L, coinbase.getOutputs().get(0).getValue());

            Block second = source.next().orElseThrow();
            Assertions.assertEquals(1, second.getHeight());
            Assertions.assertEquals(0, second.getTxCount());

            Assertions.assertTrue(source.next().isEmpty());
        }
    }

    @Test
    void testRegularInput() throws IOException, TxoDumpException {
        Path file = folder.resolve("blocks.jsonl");
        Files.writeString(file, "{\"height\":3,\"transactions\":[{\"txId\":\"" + A + "\",\"size\":1,"
                + "\"inputs\":[{\"txId\":\"0700\" ,\"vout\":2}],\"outputs\":[]}]}");

        try (JsonLinesBlockSource source = new JsonLinesBlockSource(file)) {
            TXInput input = source.next().orElseThrow().getTransactions().get(0).getInputs().get(0);
            Assertions.assertEquals(2, input.getVout());
            Assertions.assertArrayEquals(new byte[]{7, 0}, input.getTxId());
            Assertions.assertFalse(input.isCoinbase());
        }
    }

    @Test
    void testMalformedLineNamesPosition() throws IOException, TxoDumpException {
        Path file = folder.resolve("blocks.jsonl");
        Files.writeString(file, "{\"height\":0}\n{\"height\":1,\"transactions\":[{\"txId\":\"zz\"}]}\n");

        try (JsonLinesBlockSource source = new JsonLinesBlockSource(file)) {
            source.next();
            TxoDumpException e = Assertions.assertThrows(TxoDumpException.class, source::next);
            Assertions.assertTrue(e.getMessage().endsWith(":2"), e.getMessage());
        }
    }

    @Test
    void testVoutOutOfRange() throws IOException, TxoDumpException {
        Path file = folder.resolve("blocks.jsonl");
        Files.writeString(file, "{\"height\":0,\"transactions\":[{\"inputs\":[{\"txId\":\"00\",\"vout\":4294967296}]}]}\n");

        try (JsonLinesBlockSource source = new JsonLinesBlockSource(file)) {
            Assertions.assertThrows(TxoDumpException.class, source::next);
        }
    }

    @Test
    void testInputWithoutTxIdIsRejected() throws IOException, TxoDumpException {
        Path file = folder.resolve("blocks.jsonl");
        Files.writeString(file, "{\"height\":0}\n{\"height\":1,\"transactions\":[{\"txId\":\"" + A + "\",\"size\":1,"
                + "\"inputs\":[{\"vout\":0}],\"outputs\":[]}]}\n");

        try (JsonLinesBlockSource source = new JsonLinesBlockSource(file)) {
            source.next();
            TxoDumpException e = Assertions.assertThrows(TxoDumpException.class, source::next);
            Assertions.assertTrue(e.getMessage().endsWith(":2"), e.getMessage());
        }
    }

    @Test
    void testTransactionWithoutTxIdIsRejected() throws IOException, TxoDumpException {
        Path file = folder.resolve("blocks.jsonl");
        Files.writeString(file, "{\"height\":0,\"transactions\":[{\"size\":1,\"inputs\":[],\"outputs\":[]}]}\n");

        try (JsonLinesBlockSource source = new JsonLinesBlockSource(file)) {
            TxoDumpException e = Assertions.assertThrows(TxoDumpException.class, source::next);
            Assertions.assertTrue(e.getMessage().endsWith(":1"), e.getMessage());
        }
    }

    @Test
    void testNullListsAreRejected() throws IOException, TxoDumpException {
        Path file = folder.resolve("blocks.jsonl");
        Files.writeString(file, "{\"height\":0,\"transactions\":[{\"txId\":\"" + A + "\",\"inputs\":null,\"outputs\":[]}]}\n"
                + "{\"height\":1,\"transactions\":null}\n");

        try (JsonLinesBlockSource source = new JsonLinesBlockSource(file)) {
            TxoDumpException first = Assertions.assertThrows(TxoDumpException.class, source::next);
            Assertions.assertTrue(first.getMessage().endsWith(":1"), first.getMessage());
            TxoDumpException second = Assertions.assertThrows(TxoDumpException.class, source::next);
            Assertions.assertTrue(second.getMessage().endsWith(":2"), second.getMessage());
        }
    }

    @Test
    void testMissingFile() {
        Assertions.assertThrows(TxoDumpException.class, () -> new JsonLinesBlockSource(folder.resolve("none.jsonl")));
    }
}
