package com.digitalgroup.reportscheduler.integration.filetransfer;

import com.digitalgroup.reportscheduler.domain.common.enums.FileTransferProtocol;
import com.digitalgroup.reportscheduler.domain.delivery.channel.DeliveryException;

import java.util.Set;

/**
 * Uploads one file to a remote server over a file transfer protocol.
 */
public interface FileTransferClient {

    Set<FileTransferProtocol> protocols();

    /**
     * @return the absolute remote path written
     */
    String upload(RemoteTarget target, String fileName, byte[] content, int timeoutMillis) throws DeliveryException;

    /**
     * Connection settings. The password is never logged.
     */
    record RemoteTarget(FileTransferProtocol protocol, String host, int port,
                        String username, String password, String directory) {

        @Override
        public String toString() {
            return protocol + "://" + (username != null ? username + "@" : "") + host + ":" + port + directory;
        }
    }
}
