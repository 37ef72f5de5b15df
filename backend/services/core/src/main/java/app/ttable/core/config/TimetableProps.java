package app.ttable.core.config;

import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "app.timetable")
public record TimetableProps(
        // минимум пар в карточке, чтобы её можно было утвердить
        @DefaultValue("2") @Min(0) int minLessonsPerAccept,
        // сколько состояний карточки отдаём во вкладку "История"
        @DefaultValue("50") @Min(1) int historyLimit
) {
}
