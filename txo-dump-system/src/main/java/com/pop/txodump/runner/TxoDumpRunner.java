package com.pop.txodump.runner;

import com.pop.txodump.api.callback.CoinType;
import com.pop.txodump.api.exception.TxoDumpException;
import com.pop.txodump.config.TxoDumpProperties;
import com.pop.txodump.service.TXODump;
import com.pop.txodump.service.driver.BlockSource;
import com.pop.txodump.service.driver.BlockStreamDriver;
import com.pop.txodump.service.driver.JsonLinesBlockSource;
import com.pop.txodump.service.report.DumpReporter;
import com.pop.txodump.storage.UTXOSetLoader;
import com.pop.txodump.storage.hash.OutPointHasher;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

/**
 * txodump &lt;dump-folder&gt; : dumps the spent transaction outputs of the configured block file into a CSV file.
 */
@Slf4j
@Component
public class TxoDumpRunner implements ApplicationRunner {

    private final TxoDumpProperties properties;
    private final OutPointHasher outPointHasher;
    private final UTXOSetLoader utxoSetLoader;
    private final DumpReporter dumpReporter;

    public TxoDumpRunner(TxoDumpProperties properties, OutPointHasher outPointHasher,
                         UTXOSetLoader utxoSetLoader, DumpReporter dumpReporter) {
        this.properties = properties;
        this.outPointHasher = outPointHasher;
        this.utxoSetLoader = utxoSetLoader;
        this.dumpReporter = dumpReporter;
    }

    @Override
    public void run(ApplicationArguments args) throws TxoDumpException, IOException {
        Path dumpFolder = Paths.get(resolveDumpFolder(args.getNonOptionArgs()));
        if (StringUtils.isBlank(properties.getBlocksFile())) {
            throw new IllegalArgumentException("txodump.blocks-file is required");
        }
        Path blocksFile = Paths.get(properties.getBlocksFile());
        CoinType coinType = CoinType.fromName(properties.getCoinType());

        BlockStreamDriver driver = new BlockStreamDriver(coinType, properties.getStartHeight(), properties.getEndHeight());
        // 先打开区块文件，失败时不能动输出目录里上一次的结果
        try (BlockSource source = new JsonLinesBlockSource(blocksFile)) {
            TXODump dump = TXODump.create(dumpFolder, outPointHasher, properties.getExpectedUtxoCount(),
                    utxoSetLoader, dumpReporter);
            try {
                driver.run(source, dump);
            } catch (TxoDumpException | RuntimeException e) {
                dump.abort();
                throw e;
            }
        } catch (TxoDumpException e) {
            log.error("TXODump failed, {} is incomplete", dumpFolder, e);
            throw e;
        }
    }

    private String resolveDumpFolder(List<String> nonOptionArgs) {
        if (!nonOptionArgs.isEmpty()) {
            return nonOptionArgs.get(0);
        }
        if (StringUtils.isBlank(properties.getDumpFolder())) {
            throw new IllegalArgumentException("Folder to store the CSV file is required (dump-folder)");
        }
        return properties.getDumpFolder();
    }
}
