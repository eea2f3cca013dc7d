package com.digitalgroup.reportscheduler.domain.delivery.render;

import com.digitalgroup.reportscheduler.domain.delivery.channel.ReportArtifact;

/**
 * Renders a report into artifact bytes. Rendering itself lives outside this service.
 */
public interface ReportRenderer {

    ReportArtifact render(RenderRequest request) throws RenderException;
}
