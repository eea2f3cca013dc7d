package com.digitalgroup.reportscheduler.integration.filetransfer;

import com.digitalgroup.reportscheduler.domain.common.enums.FileTransferProtocol;
import com.digitalgroup.reportscheduler.domain.delivery.channel.DeliveryException;
import com.jcraft.jsch.ChannelSftp;
import com.jcraft.jsch.JSch;
import com.jcraft.jsch.JSchException;
import com.jcraft.jsch.Session;
import com.jcraft.jsch.SftpException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.io.IOException;
import java.util.EnumSet;
import java.util.Set;

/**
 * SFTP uploads over JSch with password authentication.
 */
@Slf4j
@Component
public class SftpTransferClient implements FileTransferClient {

    @Value("${app.delivery.ftp.connect-timeout-ms:15000}")
    private int connectTimeoutMs;

    @Value("${app.delivery.sftp.known-hosts:}")
    private String knownHostsFile;

    @Override
    public Set<FileTransferProtocol> protocols() {
        return EnumSet.of(FileTransferProtocol.SFTP);
    }

    /**
     * "yes" when a known_hosts file is configured. Without one the host key is not verified.
     */
    String hostKeyChecking(String host) {
        if (knownHostsFile == null || knownHostsFile.isBlank()) {
            log.warn("No SFTP known_hosts file configured (app.delivery.sftp.known-hosts), "
                    + "connecting to {} without host key verification", host);
            return "no";
        }
        return "yes";
    }

    @Override
    public String upload(RemoteTarget target, String fileName, byte[] content, int timeoutMillis)
            throws DeliveryException {
        Session session = null;
        ChannelSftp channel = null;
        try {
            JSch jsch = new JSch();
            if (knownHostsFile != null && !knownHostsFile.isBlank()) {
                jsch.setKnownHosts(knownHostsFile);
            }
            session = jsch.getSession(target.username(), target.host(), target.port());
            if (target.password() != null) {
                session.setPassword(target.password());
            }
            session.setConfig("StrictHostKeyChecking", hostKeyChecking(target.host()));
            session.setTimeout(timeoutMillis);
            session.connect(Math.min(connectTimeoutMs, timeoutMillis));

            channel = (ChannelSftp) session.openChannel("sftp");
            channel.connect(Math.min(connectTimeoutMs, timeoutMillis));

            String directory = FtpTransferClient.normalizeDirectory(target.directory());
            ensureDirectory(channel, directory);

            String remotePath = directory.endsWith("/") ? directory + fileName : directory + "/" + fileName;
            try (InputStream in = new ByteArrayInputStream(content)) {
                channel.put(in, remotePath, ChannelSftp.OVERWRITE);
            }

            log.info("Uploaded {} ({} bytes) to {}", fileName, content.length, target);
            return remotePath;

        } catch (JSchException e) {
            throw classify(e);
        } catch (SftpException e) {
            throw classify(e);
        } catch (IOException e) {
            throw DeliveryException.transientError("SFTP transfer failed: " + e.getMessage(), e);
        } finally {
            if (channel != null) {
                channel.disconnect();
            }
            if (session != null) {
                session.disconnect();
            }
        }
    }

    // ==================== HELPER METHODS ====================

    private void ensureDirectory(ChannelSftp channel, String directory) throws SftpException {
        if ("/".equals(directory)) {
            return;
        }
        StringBuilder path = new StringBuilder(directory.startsWith("/") ? "" : ".");
        for (String segment : directory.split("/")) {
            if (segment.isEmpty()) {
                continue;
            }
            path.append('/').append(segment);
            try {
                channel.stat(path.toString());
            } catch (SftpException e) {
                if (e.id != ChannelSftp.SSH_FX_NO_SUCH_FILE) {
                    throw e;
                }
                channel.mkdir(path.toString());
            }
        }
    }

    static DeliveryException classify(JSchException e) {
        String message = e.getMessage() != null ? e.getMessage() : "";
        if (message.contains("Auth fail") || message.contains("UnknownHostKey") || message.contains("HostKey")
                || e.getCause() instanceof java.net.UnknownHostException) {
            return DeliveryException.permanentError("SFTP connection rejected: " + message, e);
        }
        return DeliveryException.transientError("SFTP connection failed: " + message, e);
    }

    static DeliveryException classify(SftpException e) {
        if (e.id == ChannelSftp.SSH_FX_PERMISSION_DENIED || e.id == ChannelSftp.SSH_FX_NO_SUCH_FILE) {
            return DeliveryException.permanentError("SFTP upload rejected: " + e.getMessage(), e);
        }
        return DeliveryException.transientError("SFTP upload failed: " + e.getMessage(), e);
    }
}
