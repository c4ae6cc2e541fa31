package io.github.riemr.timetable.domain;

/**
 * 探索前の入力検証で不正と判断された場合に送出する。
 * 探索の失敗（時間切れ・解なし）とは区別し、例外としては扱わない。
 */
public class InvalidProblemException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    public InvalidProblemException(String message) {
        super(message);
    }
}
