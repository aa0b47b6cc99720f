package com.pop.txodump.service.driver;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonDeserializationContext;
import com.google.gson.JsonDeserializer;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.TypeAdapter;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonToken;
import com.google.gson.stream.JsonWriter;
import com.pop.txodump.api.data.block.Block;
import com.pop.txodump.api.data.transaction.TXInput;
import com.pop.txodump.api.data.transaction.Transaction;
import com.pop.txodump.api.exception.TxoDumpException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.codec.DecoderException;
import org.apache.commons.codec.binary.Hex;
import org.apache.commons.lang3.StringUtils;

import java.io.BufferedReader;
import java.io.IOException;
import java.lang.reflect.Type;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Reads blocks from a file holding one JSON object per line:
 * <pre>
 * {"height":1,"transactions":[{"txId":"ab..","size":250,"inputs":[{"txId":"cd..","vout":0}],"outputs":[{"value":4900}]}]}
 * </pre>
 * Hashes are hex strings, {@code vout} is unsigned (coinbase inputs use 4294967295).
 */
@Slf4j
public class JsonLinesBlockSource implements BlockSource {

    private static final Gson GSON = new GsonBuilder()
            .registerTypeAdapter(byte[].class, new HexBytesAdapter().nullSafe())
            .registerTypeAdapter(TXInput.class, new TXInputDeserializer())
            .create();

    private final Path file;
    private final BufferedReader reader;
    private long lineNumber;

    public JsonLinesBlockSource(Path file) throws TxoDumpException {
        this.file = file;
        try {
            this.reader = Files.newBufferedReader(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new TxoDumpException("Unable to open block file " + file, e);
        }
        log.debug("Reading blocks from {}", file);
    }

    @Override
    public Optional<Block> next() throws TxoDumpException {
        try {
            String line;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                if (StringUtils.isBlank(line)) {
                    continue;
                }
                Block block = GSON.fromJson(line, Block.class);
                if (block == null) {
                    continue;
                }
                validate(block);
                return Optional.of(block);
            }
            return Optional.empty();
        } catch (JsonParseException e) {
            throw new TxoDumpException("Malformed block at " + file + ":" + lineNumber, e);
        } catch (IOException e) {
            throw new TxoDumpException("Unable to read block file " + file, e);
        }
    }

    private static void validate(Block block) {
        if (block.getTransactions() == null) {
            throw new JsonParseException("Block " + block.getHeight() + " without transactions");
        }
        for (Transaction transaction : block.getTransactions()) {
            if (transaction == null) {
                throw new JsonParseException("Null transaction in block " + block.getHeight());
            }
            if (transaction.getTxId() == null) {
                throw new JsonParseException("Transaction without txId in block " + block.getHeight());
            }
            if (transaction.getInputs() == null || transaction.getOutputs() == null) {
                throw new JsonParseException("Transaction without inputs or outputs in block " + block.getHeight());
            }
        }
    }

    @Override
    public void close() throws IOException {
        reader.close();
    }

    private static class HexBytesAdapter extends TypeAdapter<byte[]> {

        @Override
        public void write(JsonWriter out, byte[] value) throws IOException {
            out.value(Hex.encodeHexString(value));
        }

        @Override
        public byte[] read(JsonReader in) throws IOException {
            if (in.peek() != JsonToken.STRING) {
                throw new JsonParseException("Expected a hex string at " + in.getPath());
            }
            String hex = in.nextString();
            try {
                return Hex.decodeHex(hex);
            } catch (DecoderException e) {
                throw new JsonParseException("Invalid hex at " + in.getPath() + ": " + hex, e);
            }
        }
    }

    private static class TXInputDeserializer implements JsonDeserializer<TXInput> {

        @Override
        public TXInput deserialize(JsonElement json, Type typeOfT, JsonDeserializationContext context) {
            if (!json.isJsonObject()) {
                throw new JsonParseException("Input is not an object: " + json);
            }
            JsonObject object = json.getAsJsonObject();
            JsonElement vout = object.get("vout");
            if (vout == null || vout.isJsonNull()) {
                throw new JsonParseException("Input without vout: " + json);
            }
            long index;
            try {
                index = vout.getAsLong();
            } catch (NumberFormatException | UnsupportedOperationException | IllegalStateException e) {
                throw new JsonParseException("Invalid vout: " + vout, e);
            }
            if (index < 0 || index > 0xFFFFFFFFL) {
                throw new JsonParseException("vout out of unsigned 32-bit range: " + index);
            }
            JsonElement id = object.get("txId");
            if (id == null || id.isJsonNull()) {
                throw new JsonParseException("Input without txId: " + json);
            }
            byte[] txId = context.deserialize(id, byte[].class);
            return new TXInput(txId, (int) index);
        }
    }
}
