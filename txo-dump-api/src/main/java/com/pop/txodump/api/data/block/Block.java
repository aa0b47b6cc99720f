package com.pop.txodump.api.data.block;

import com.pop.txodump.api.data.transaction.Transaction;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

/**
 * A block of the linearized chain. The height is carried for sources that store it next to the block; the
 * driver always passes the height explicitly to the callback.
 */
@Data
@AllArgsConstructor
@NoArgsConstructor
@ToString(exclude = "transactions")
public class Block implements Serializable {

    private long height;

    /**
     * Transactions in block order, coinbase first
     */
    private List<Transaction> transactions = new ArrayList<>();

    public int getTxCount() {
        return transactions.size();
    }
}
