package com.ciro.jsonui.gen;

import com.ciro.jsonui.ast.ComponentNode;
import com.ciro.jsonui.ast.LayoutReader;
import com.ciro.jsonui.binding.BindingConventions;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class StateScaffoldGeneratorTest {

    private final StateScaffoldGenerator generator = new StateScaffoldGenerator(BindingConventions.STANDARD);
    private final LayoutReader reader = new LayoutReader();

    @Test
    void typescriptHookWiresDefaultHandlers() {
        ComponentNode root = reader.read("signup", """
                {"type": "View", "child": [
                  {"type": "TextField", "text": "@{email}"},
                  {"type": "Switch", "isOn": "@{form.agree}"},
                  {"type": "TextField", "text": "@{name}", "onTextChange": "@{nameChanged}"}
                ]}
                """);
        String out = generator.generate("Signup", root, OutputFlavor.TYPESCRIPT);

        assertTrue(out.startsWith("\"use client\";\n\n// Generated by jsonui - do not edit directly\n"));
        assertTrue(out.contains("import { SignupData, createSignupData } from \"@/generated/data/SignupData\";"));
        assertTrue(out.contains("export function useSignupViewModel(initial?: Partial<SignupData>) {"));
        assertTrue(out.contains("useState<SignupData>({ ...createSignupData(), ...initial });"));
        assertTrue(out.contains("    onEmailChange: data.onEmailChange ?? ((value: string) => "
                + "setData(prev => ({ ...prev, email: value }))),\n"));
        assertTrue(out.contains("    onAgreeChange: data.onAgreeChange ?? ((value: boolean) => "
                + "setData(prev => ({ ...prev, form: { ...prev.form, agree: value } }))),\n"));
        assertFalse(out.contains("onNameChange"));
        assertTrue(out.endsWith("  return { data: dataWithDefaults, setData };\n}\n"));
    }

    @Test
    void plainHookWithoutHandlers() {
        ComponentNode root = reader.read("about", "{\"type\": \"Label\", \"text\": \"About\"}");
        String out = generator.generate("About", root, OutputFlavor.PLAIN);
        assertTrue(out.contains("export function useAboutViewModel(initial) {"));
        assertTrue(out.contains("  const dataWithDefaults = data;\n"));
        assertFalse(out.contains("SignupData"));
    }

    @Test
    void nestedUpdateSpreadsEveryLevel() {
        assertEquals("({ ...prev, a: { ...prev.a, b: { ...prev.a.b, c: value } } })",
                StateScaffoldGenerator.update("prev", new String[]{"a", "b", "c"}, 0));
        assertEquals("({ ...prev, email: value })",
                StateScaffoldGenerator.update("prev", new String[]{"email"}, 0));
    }
}
