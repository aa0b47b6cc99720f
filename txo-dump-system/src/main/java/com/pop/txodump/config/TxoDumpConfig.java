package com.pop.txodump.config;

import com.pop.txodump.service.report.DumpReporter;
import com.pop.txodump.service.report.Slf4jDumpReporter;
import com.pop.txodump.storage.NoopUTXOSetLoader;
import com.pop.txodump.storage.UTXOSetLoader;
import com.pop.txodump.storage.hash.GuavaOutPointHasher;
import com.pop.txodump.storage.hash.OutPointHasher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class TxoDumpConfig {

    @Bean
    public OutPointHasher outPointHasher(TxoDumpProperties properties) {
        return new GuavaOutPointHasher(properties.getHashFunction());
    }

    @Bean
    public UTXOSetLoader utxoSetLoader() {
        return new NoopUTXOSetLoader();
    }

    @Bean
    public DumpReporter dumpReporter() {
        return new Slf4jDumpReporter();
    }
}
