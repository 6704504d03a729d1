package work.lcod.empaths.runtime;

import java.lang.reflect.Array;
import java.util.List;

abstract class SequenceHandle implements IndexedHandle {
    static SequenceHandle ofList(List<?> list) {
        return new SequenceHandle() {
            @Override
            public Object raw() {
                return list;
            }

            @Override
            public int length() {
                return list.size();
            }

            @Override
            public Value at(int index) {
                return Values.of(list.get(index));
            }
        };
    }

    static SequenceHandle ofArray(Object array) {
        return new SequenceHandle() {
            @Override
            public Object raw() {
                return array;
            }

            @Override
            public int length() {
                return Array.getLength(array);
            }

            @Override
            public Value at(int index) {
                return Values.of(Array.get(array, index));
            }
        };
    }
}
