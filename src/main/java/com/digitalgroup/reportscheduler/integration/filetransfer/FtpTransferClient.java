package com.digitalgroup.reportscheduler.integration.filetransfer;

import com.digitalgroup.reportscheduler.domain.common.enums.FileTransferProtocol;
import com.digitalgroup.reportscheduler.domain.delivery.channel.DeliveryException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.net.ftp.FTP;
import org.apache.commons.net.ftp.FTPClient;
import org.apache.commons.net.ftp.FTPReply;
import org.apache.commons.net.ftp.FTPSClient;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.UnknownHostException;
import java.time.Duration;
import java.util.EnumSet;
import java.util.Set;

/**
 * FTP and explicit FTPS uploads (passive mode, binary) using Apache Commons Net.
 */
@Slf4j
@Component
public class FtpTransferClient implements FileTransferClient {

    @Value("${app.delivery.ftp.connect-timeout-ms:15000}")
    private int connectTimeoutMs;

    @Override
    public Set<FileTransferProtocol> protocols() {
        return EnumSet.of(FileTransferProtocol.FTP, FileTransferProtocol.FTPS);
    }

    @Override
    public String upload(RemoteTarget target, String fileName, byte[] content, int timeoutMillis)
            throws DeliveryException {
        FTPClient ftp = createClient(target.protocol());
        ftp.setConnectTimeout(Math.min(connectTimeoutMs, timeoutMillis));
        ftp.setDefaultTimeout(timeoutMillis);
        ftp.setDataTimeout(Duration.ofMillis(timeoutMillis));

        try {
            ftp.connect(target.host(), target.port());
            if (!FTPReply.isPositiveCompletion(ftp.getReplyCode())) {
                throw DeliveryException.transientError("FTP server refused connection: " + ftp.getReplyString(), null);
            }
            String username = target.username() != null ? target.username() : "anonymous";
            String password = target.password() != null ? target.password() : "";
            if (!ftp.login(username, password)) {
                throw DeliveryException.permanentError("FTP login failed for user " + username);
            }
            if (ftp instanceof FTPSClient ftps) {
                ftps.execPBSZ(0);
                ftps.execPROT("P");
            }
            ftp.enterLocalPassiveMode();
            ftp.setFileType(FTP.BINARY_FILE_TYPE);

            String directory = normalizeDirectory(target.directory());
            changeToDirectory(ftp, directory);

            try (InputStream in = new ByteArrayInputStream(content)) {
                if (!ftp.storeFile(fileName, in)) {
                    throw replyError(ftp, "FTP upload of " + fileName + " rejected");
                }
            }
            ftp.logout();

            String remotePath = directory.endsWith("/") ? directory + fileName : directory + "/" + fileName;
            log.info("Uploaded {} ({} bytes) to {}", fileName, content.length, target);
            return remotePath;

        } catch (UnknownHostException e) {
            throw DeliveryException.permanentError("Unknown FTP host: " + target.host(), e);
        } catch (IOException e) {
            throw DeliveryException.transientError("FTP transfer failed: " + e.getMessage(), e);
        } finally {
            disconnect(ftp);
        }
    }

    FTPClient createClient(FileTransferProtocol protocol) {
        return protocol == FileTransferProtocol.FTPS ? new FTPSClient(false) : new FTPClient();
    }

    // ==================== HELPER METHODS ====================

    private void changeToDirectory(FTPClient ftp, String directory) throws IOException, DeliveryException {
        if (ftp.changeWorkingDirectory(directory)) {
            return;
        }
        // create missing segments one by one
        if (directory.startsWith("/")) {
            ftp.changeWorkingDirectory("/");
        }
        for (String segment : directory.split("/")) {
            if (segment.isEmpty()) {
                continue;
            }
            if (!ftp.changeWorkingDirectory(segment)) {
                if (!ftp.makeDirectory(segment) || !ftp.changeWorkingDirectory(segment)) {
                    throw replyError(ftp, "Cannot create remote directory " + directory);
                }
            }
        }
    }

    private DeliveryException replyError(FTPClient ftp, String message) {
        int reply = ftp.getReplyCode();
        String detail = message + ": " + (ftp.getReplyString() != null ? ftp.getReplyString().trim() : reply);
        // 5xx replies (permission denied, bad file name) will not change on retry
        if (FTPReply.isNegativePermanent(reply)) {
            return DeliveryException.permanentError(detail);
        }
        return DeliveryException.transientError(detail, null);
    }

    private void disconnect(FTPClient ftp) {
        if (ftp.isConnected()) {
            try {
                ftp.disconnect();
            } catch (IOException e) {
                log.debug("Error closing FTP connection: {}", e.getMessage());
            }
        }
    }

    static String normalizeDirectory(String directory) {
        if (directory == null || directory.isBlank()) {
            return "/";
        }
        String trimmed = directory.trim();
        return trimmed.length() > 1 && trimmed.endsWith("/") ? trimmed.substring(0, trimmed.length() - 1) : trimmed;
    }
}
