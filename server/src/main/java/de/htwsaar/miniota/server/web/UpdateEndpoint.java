package de.htwsaar.miniota.server.web;

import de.htwsaar.miniota.server.firmware.FirmwareArtifact;
import de.htwsaar.miniota.server.firmware.FirmwareStore;
import de.htwsaar.miniota.server.transfer.ArtifactStreamer;
import de.htwsaar.miniota.server.transfer.ByteRange;
import de.htwsaar.miniota.server.transfer.RangeRequestParser;
import de.htwsaar.miniota.server.transfer.TransferResult;
import java.io.IOException;
import java.io.OutputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;

/**
 * {@code GET /update}: liefert die Firmware ganz (200) oder einen Bereich (206).
 */
public class UpdateEndpoint implements Endpoint {

    private static final Logger log = LoggerFactory.getLogger(UpdateEndpoint.class);

    public static final String PATH = "/update";

    private final FirmwareStore store;
    private final RangeRequestParser rangeParser;
    private final ArtifactStreamer streamer;

    public UpdateEndpoint(FirmwareStore store, RangeRequestParser rangeParser, ArtifactStreamer streamer) {
        this.store = store;
        this.rangeParser = rangeParser;
        this.streamer = streamer;
    }

    @Override
    public String path() {
        return PATH;
    }

    @Override
    public void get(OtaExchange exchange) throws IOException {
        FirmwareArtifact artifact = store.snapshot();
        String rangeHeader = exchange.request().header(HttpHeaders.RANGE);
        ByteRange range = rangeParser.parse(rangeHeader, artifact.size());
        boolean partial = RangeRequestParser.isRangeRequest(rangeHeader);

        HttpHeaders h = new HttpHeaders();
        h.setContentType(MediaType.APPLICATION_OCTET_STREAM);
        h.setContentLength(range.length());
        if (partial) {
            h.set(HttpHeaders.CONTENT_RANGE, range.toContentRange(artifact.size()));
        }
        h.set(HttpHeaders.ACCEPT_RANGES, "bytes");
        h.set(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=" + artifact.fileName());

        HttpStatus status = partial ? HttpStatus.PARTIAL_CONTENT : HttpStatus.OK;
        if (partial) {
            log.info("Sending bytes {}-{}/{} of {}", range.start(), range.end(), artifact.size(), artifact.fileName());
        } else {
            log.info("Sending full firmware {} ({} bytes)", artifact.fileName(), artifact.size());
        }

        OutputStream body = exchange.beginBody(status, h);
        TransferResult result = streamer.stream(artifact.path(), range, body);
        if (result.complete()) {
            log.info("Transfer complete: {} bytes", result.bytesWritten());
        } else {
            log.info("Transfer aborted: {} of {} bytes", result.bytesWritten(), result.expected());
        }
    }
}
