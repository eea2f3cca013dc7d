package com.digitalgroup.reportscheduler.domain.common.enums;

import lombok.Getter;

@Getter
public enum FileTransferProtocol {
    FTP(21),
    FTPS(21),
    SFTP(22);

    private final int defaultPort;

    FileTransferProtocol(int defaultPort) {
        this.defaultPort = defaultPort;
    }
}
