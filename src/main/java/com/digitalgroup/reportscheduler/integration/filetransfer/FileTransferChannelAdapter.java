package com.digitalgroup.reportscheduler.integration.filetransfer;

import com.digitalgroup.reportscheduler.domain.common.enums.DeliveryMethod;
import com.digitalgroup.reportscheduler.domain.common.enums.FileTransferProtocol;
import com.digitalgroup.reportscheduler.domain.delivery.channel.ChannelAdapter;
import com.digitalgroup.reportscheduler.domain.delivery.channel.DeliveryContext;
import com.digitalgroup.reportscheduler.domain.delivery.channel.DeliveryException;
import com.digitalgroup.reportscheduler.domain.delivery.channel.DeliveryReceipt;
import com.digitalgroup.reportscheduler.domain.delivery.channel.ReportArtifact;
import com.digitalgroup.reportscheduler.domain.schedule.entity.DeliveryConfiguration;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Uploads the artifact to the configured FTP, FTPS or SFTP server.
 * Re-uploading on retry overwrites the same remote file.
 */
@Component
public class FileTransferChannelAdapter implements ChannelAdapter {

    private final Map<FileTransferProtocol, FileTransferClient> clients = new EnumMap<>(FileTransferProtocol.class);

    public FileTransferChannelAdapter(List<FileTransferClient> clients) {
        for (FileTransferClient client : clients) {
            for (FileTransferProtocol protocol : client.protocols()) {
                this.clients.put(protocol, client);
            }
        }
    }

    @Override
    public DeliveryMethod method() {
        return DeliveryMethod.FTP;
    }

    @Override
    public DeliveryReceipt deliver(ReportArtifact artifact, DeliveryContext context) throws DeliveryException {
        DeliveryConfiguration settings = context.getSettings();
        if (settings.getFtpHost() == null || settings.getFtpHost().isBlank()) {
            throw DeliveryException.permanentError("FTP host is not configured");
        }
        FileTransferProtocol protocol = settings.getFtpProtocol() != null ? settings.getFtpProtocol() : FileTransferProtocol.FTP;
        FileTransferClient client = clients.get(protocol);
        if (client == null) {
            throw DeliveryException.permanentError("Unsupported file transfer protocol: " + protocol);
        }

        FileTransferClient.RemoteTarget target = new FileTransferClient.RemoteTarget(
                protocol,
                settings.getFtpHost().trim(),
                settings.effectiveFtpPort(),
                settings.getFtpUsername(),
                settings.getFtpPassword(),
                context.render(settings.getFtpPath()));

        String remotePath = client.upload(target, artifact.fileName(), artifact.content(),
                context.remainingTimeoutMillis());
        return new DeliveryReceipt(method(), protocol.name().toLowerCase() + "://" + target.host() + remotePath);
    }
}
