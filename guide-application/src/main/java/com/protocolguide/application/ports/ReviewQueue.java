package com.protocolguide.application.ports;

import com.protocolguide.saas.domain.model.ReviewFlag;

public interface ReviewQueue {

    void flag(ReviewFlag flag);
}
