package com.verve.domain.epic.model.valobj;

import com.verve.types.enums.EpicFeedbackTypeEnum;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 规划会话信箱中的一条反馈。
 */
@Getter
@AllArgsConstructor
public class EpicFeedback {

    private final EpicFeedbackTypeEnum type;
    private final String feedback;
}
