package com.pop.txodump.api.data.transaction;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;

/**
 * Transaction output
 */
@Data
@AllArgsConstructor
@NoArgsConstructor
public class TXOutput implements Serializable {

    /**
     * Amount in the chain's smallest unit, unsigned 64-bit
     */
    private long value;
}
