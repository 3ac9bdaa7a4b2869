package ini;

import lombok.AllArgsConstructor;
import lombok.Data;

@AllArgsConstructor
@Data
class Symbol {
    private String pattern;
    private String replacement;
}
