package com.pop.txodump.config;

import com.pop.txodump.storage.UTXOSet;
import com.pop.txodump.storage.hash.HashAlgorithm;
import jakarta.annotation.PostConstruct;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Slf4j
@Data
@Component
@ConfigurationProperties(prefix = "txodump")
public class TxoDumpProperties {

    // 输出目录，必须存在且可写；命令行第一个参数优先
    private String dumpFolder;

    // 每行一个区块的JSON文件
    private String blocksFile;

    private String coinType = "BITCOIN";

    private long startHeight = 0;

    // -1 读到文件末尾
    private long endHeight = -1;

    // UTXO集合预分配大小
    private int expectedUtxoCount = UTXOSet.DEFAULT_EXPECTED_SIZE;

    private HashAlgorithm hashFunction = HashAlgorithm.FARM_HASH_64;

    @PostConstruct
    public void init() {
        log.info("输出目录:{}", dumpFolder);
        log.info("区块文件:{}", blocksFile);
        log.info("币种:{} 高度范围:{}..{}", coinType, startHeight, endHeight);
        log.info("UTXO预分配:{} 哈希函数:{}", expectedUtxoCount, hashFunction);
    }
}
