package io.github.samzhu.medlog.document;

import java.util.Arrays;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 藥物類型。
 *
 * <p>JSON 中以小寫字串表示（{@code spray}、{@code ventoline}）。
 * 宣告順序即遷移時處理各類型的順序。
 */
public enum MedicineType {

    SPRAY("spray"),
    VENTOLINE("ventoline");

    private final String value;

    MedicineType(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    /**
     * 由 JSON 字串解析藥物類型。
     *
     * @param value 小寫類型名稱
     * @return 對應的類型
     * @throws IllegalArgumentException 若不是已知類型
     */
    @JsonCreator
    public static MedicineType fromValue(String value) {
        return Arrays.stream(values())
            .filter(t -> t.value.equals(value))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException(
                "type must be one of 'spray' or 'ventoline', got '" + value + "'"));
    }

    @Override
    public String toString() {
        return value;
    }
}
