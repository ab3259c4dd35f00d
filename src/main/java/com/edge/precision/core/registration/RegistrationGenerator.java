package com.edge.precision.core.registration;

/**
 * 配准候选生成器
 * <p>
 * 实现不得向外抛出 OpenCV 异常，失败以无效候选返回
 */
public interface RegistrationGenerator {

    RegistrationMethod getMethod();

    RegistrationCandidate produceCandidate(RegistrationInput input);
}
