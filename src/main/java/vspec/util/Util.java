// Copyright 2020 The Whiley Project Developers
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//    http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
package vspec.util;

import vspec.core.Vir.Expr;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

public class Util {

    /**
     * Apply a given function to every element of a list, producing a fresh list
     * of the results in the same order.
     *
     * @param items
     * @param fn
     * @param <S>
     * @param <T>
     * @return
     */
    public static <S,T> List<T> map(List<S> items, Function<S,T> fn) {
        ArrayList<T> rs = new ArrayList<>();
        for(int i=0;i!=items.size();++i) {
            rs.add(fn.apply(items.get(i)));
        }
        return rs;
    }

    /**
     * Construct the path of a place by joining the name of its root variable with
     * the names of its accessors, such as <code>_1.tuple_0.val_int</code>.
     *
     * @param place
     * @return
     */
    public static String toPath(Expr.Place place) {
        if(place instanceof Expr.FieldAccess) {
            Expr.FieldAccess access = (Expr.FieldAccess) place;
            return toPath(access.getBase()) + "." + access.getField().getName();
        } else {
            return ((Expr.LocalVar) place).getName();
        }
    }
}
